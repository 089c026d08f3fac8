package com.hamclock.rigdaemon.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /mode}. {@code passband} is only honoured by rigctld; 0 keeps the rig's default.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ModeRequest {

    @NotBlank(message = "Missing mode")
    private String mode;

    @PositiveOrZero(message = "passband cannot be negative")
    private Integer passband;

    public int passbandOrDefault() {
        return passband != null ? passband : 0;
    }
}
