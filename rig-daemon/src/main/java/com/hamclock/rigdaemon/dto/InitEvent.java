package com.hamclock.rigdaemon.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.hamclock.rigdaemon.model.RadioSnapshot;

/**
 * First message on every stream: the full radio state at subscription time.
 */
@JsonPropertyOrder({"type", "connected", "freq", "mode", "width", "ptt"})
public record InitEvent(
        String type,
        boolean connected,
        long freq,
        String mode,
        int width,
        boolean ptt) implements RigEvent {

    public static final String TYPE = "init";

    public static InitEvent of(RadioSnapshot snapshot) {
        return new InitEvent(TYPE, snapshot.connected(), snapshot.frequencyHz(), snapshot.mode(),
                snapshot.passbandHz(), snapshot.transmitEnabled());
    }
}
