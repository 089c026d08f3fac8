package com.hamclock.rigdaemon.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.hamclock.rigdaemon.model.RadioSnapshot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code GET /status}. {@code timestamp} is epoch milliseconds of the last update.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"connected", "freq", "mode", "width", "ptt", "timestamp"})
public class RadioStatusResponse {

    private boolean connected;
    private long freq;
    private String mode;
    private int width;
    private boolean ptt;
    private long timestamp;

    public static RadioStatusResponse from(RadioSnapshot snapshot) {
        return RadioStatusResponse.builder()
                .connected(snapshot.connected())
                .freq(snapshot.frequencyHz())
                .mode(snapshot.mode())
                .width(snapshot.passbandHz())
                .ptt(snapshot.transmitEnabled())
                .timestamp(snapshot.lastUpdateAt().toEpochMilli())
                .build();
    }
}
