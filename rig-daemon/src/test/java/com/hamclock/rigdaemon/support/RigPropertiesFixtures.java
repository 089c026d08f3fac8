package com.hamclock.rigdaemon.support;

import com.hamclock.rigdaemon.config.RigProperties;

/**
 * Builds {@link RigProperties} with the shipped defaults and a few overrides.
 */
public final class RigPropertiesFixtures {

    private RigPropertiesFixtures() {}

    public static RigProperties defaults(String type) {
        return new RigProperties(type, "127.0.0.1", null, 1000, false, 3000, 5000, 0, 3000, 100);
    }

    public static RigProperties withPtt(String type, boolean pttEnabled) {
        return new RigProperties(type, "127.0.0.1", null, 1000, pttEnabled, 3000, 5000, 0, 3000, 100);
    }

    public static RigProperties rigctld(int port, long reconnectDelayMs, long commandTimeoutMs) {
        return new RigProperties("rigctld", "127.0.0.1", port, 1000, false, 3000, reconnectDelayMs,
                commandTimeoutMs, 1000, 100);
    }
}
