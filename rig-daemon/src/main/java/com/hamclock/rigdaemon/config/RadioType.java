package com.hamclock.rigdaemon.config;

import java.util.Locale;

/**
 * Rig-control backend selected once at startup.
 */
public enum RadioType {

    // Hamlib rigctld line protocol over TCP
    RIGCTLD(4532),

    // flrig XML-RPC over HTTP
    FLRIG(12345),

    // In-process simulation, no network I/O
    MOCK(0);

    private final int defaultPort;

    RadioType(int defaultPort) {
        this.defaultPort = defaultPort;
    }

    public int defaultPort() {
        return defaultPort;
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    // Case-insensitive lookup; anything unrecognised runs the rigctld adapter
    public static RadioType fromString(String value) {
        if (value == null || value.isBlank()) {
            return RIGCTLD;
        }
        for (RadioType type : values()) {
            if (type.name().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        return RIGCTLD;
    }
}
