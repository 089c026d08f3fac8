package com.hamclock.rigdaemon.dto;

import com.hamclock.rigdaemon.config.RigProperties;
import lombok.Builder;
import lombok.Value;

/**
 * Read-only view of the effective radio configuration served by {@code GET /config}.
 */
@Value
@Builder
public class ConfigResponse {

    String type;
    String host;
    int port;
    long pollInterval;
    boolean pttEnabled;
    long tuneDelay;

    public static ConfigResponse from(RigProperties properties) {
        return ConfigResponse.builder()
                .type(properties.radioType().id())
                .host(properties.host())
                .port(properties.effectivePort())
                .pollInterval(properties.pollInterval())
                .pttEnabled(properties.pttEnabled())
                .tuneDelay(properties.tuneDelay())
                .build();
    }
}
