package com.hamclock.rigdaemon.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /ptt}. A missing {@code ptt} means unkey.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PttRequest {

    private Boolean ptt;

    public boolean transmit() {
        return Boolean.TRUE.equals(ptt);
    }
}
