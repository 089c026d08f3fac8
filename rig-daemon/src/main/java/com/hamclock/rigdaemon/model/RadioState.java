package com.hamclock.rigdaemon.model;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * The single shared radio record. Adapters write it through the change broadcaster, the HTTP layer
 * reads {@link #snapshot()} copies.
 * <p>
 * Every setter is a compare-and-set: it returns {@code true} only when the stored value actually
 * changed, so callers can decide whether a change event is due.
 */
public class RadioState {

    private final Clock clock;

    private long frequencyHz;
    private String mode = "";
    private int passbandHz;
    private boolean transmitEnabled;
    private boolean connected;
    private Instant lastUpdateAt = Instant.EPOCH;

    public RadioState() {
        this(Clock.systemUTC());
    }

    public RadioState(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public synchronized boolean setFrequencyHz(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("frequency cannot be negative: " + value);
        }
        if (frequencyHz == value) {
            return false;
        }
        frequencyHz = value;
        return true;
    }

    public synchronized boolean setMode(String value) {
        String next = value == null ? "" : value;
        if (mode.equals(next)) {
            return false;
        }
        mode = next;
        return true;
    }

    public synchronized boolean setPassbandHz(int value) {
        if (value < 0) {
            throw new IllegalArgumentException("passband cannot be negative: " + value);
        }
        if (passbandHz == value) {
            return false;
        }
        passbandHz = value;
        return true;
    }

    public synchronized boolean setTransmitEnabled(boolean value) {
        if (transmitEnabled == value) {
            return false;
        }
        transmitEnabled = value;
        return true;
    }

    public synchronized boolean setConnected(boolean value) {
        if (connected == value) {
            return false;
        }
        connected = value;
        return true;
    }

    public synchronized void touch() {
        lastUpdateAt = clock.instant();
    }

    public synchronized boolean isConnected() {
        return connected;
    }

    public synchronized RadioSnapshot snapshot() {
        return new RadioSnapshot(frequencyHz, mode, passbandHz, transmitEnabled, connected, lastUpdateAt);
    }
}
