package com.hamclock.rigdaemon.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

//* Immutable radio backend configuration.
// type – backend adapter: rigctld | flrig | mock (default: rigctld)
// host – backend host (default: 127.0.0.1)
// rigPort – backend port; null means the backend's default (4532 rigctld, 12345 flrig)
// pollInterval – milliseconds between poll ticks (default: 1000)
// pttEnabled – allow transmit to be keyed through the write API (default: false)
// tuneDelay – milliseconds between a frequency write and tune, also the fallback key-down time (default: 3000)
// reconnectDelay – fixed delay in milliseconds before a dropped rigctld link is re-dialled (default: 5000)
// commandTimeout – milliseconds a rigctld command may stay in flight; 0 disables the timeout (default: 0)
// connectTimeout – TCP connect timeout in milliseconds (default: 3000)
// repollDelay – milliseconds between a confirmed write and the confirming re-poll (default: 100)
@ConfigurationProperties(prefix = "rig.radio")
public record RigProperties(
    @DefaultValue("rigctld") String type,
    @DefaultValue("127.0.0.1") String host,
    Integer rigPort,
    @DefaultValue("1000") long pollInterval,
    @DefaultValue("false") boolean pttEnabled,
    @DefaultValue("3000") long tuneDelay,
    @DefaultValue("5000") long reconnectDelay,
    @DefaultValue("0") long commandTimeout,
    @DefaultValue("3000") int connectTimeout,
    @DefaultValue("100") long repollDelay
) {

    public static final long DEFAULT_TUNE_DELAY_MS = 3000;

    // Compact constructor with validation
    public RigProperties {
        if (type == null || type.isBlank()) {
            type = RadioType.RIGCTLD.id();
        }
        if (host == null || host.isBlank()) {
            host = "127.0.0.1";
        }
        if (rigPort != null && (rigPort <= 0 || rigPort > 65535)) {
            throw new IllegalArgumentException("Rig port must be between 1 and 65535, got: " + rigPort);
        }
        if (pollInterval <= 0) {
            throw new IllegalArgumentException("Poll interval must be positive, got: " + pollInterval);
        }
        if (tuneDelay < 0) {
            tuneDelay = DEFAULT_TUNE_DELAY_MS;
        }
        if (reconnectDelay <= 0) {
            throw new IllegalArgumentException("Reconnect delay must be positive, got: " + reconnectDelay);
        }
        if (commandTimeout < 0) {
            throw new IllegalArgumentException("Command timeout cannot be negative, got: " + commandTimeout);
        }
        if (connectTimeout < 1) {
            throw new IllegalArgumentException("Connect timeout must be at least 1 ms, got: " + connectTimeout);
        }
        if (repollDelay < 0) {
            repollDelay = 0;
        }
    }

    public RadioType radioType() {
        return RadioType.fromString(type);
    }

    /**
     * Port actually dialled: the configured one, or the backend's default when none was given.
     */
    public int effectivePort() {
        return rigPort != null ? rigPort : radioType().defaultPort();
    }
}
