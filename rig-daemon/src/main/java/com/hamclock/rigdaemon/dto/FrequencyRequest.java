package com.hamclock.rigdaemon.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /freq}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FrequencyRequest {

    @NotNull(message = "Missing freq")
    @PositiveOrZero(message = "freq cannot be negative")
    private Long freq;

    private Boolean tune;

    public boolean tuneRequested() {
        return Boolean.TRUE.equals(tune);
    }
}
