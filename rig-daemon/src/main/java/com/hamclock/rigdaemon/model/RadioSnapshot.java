package com.hamclock.rigdaemon.model;

import java.time.Instant;

/**
 * Immutable copy of {@link RadioState} taken under its lock.
 *
 * @param frequencyHz     VFO frequency in Hz
 * @param mode            backend-reported mode name, empty until first read
 * @param passbandHz      filter width in Hz, only reported by rigctld
 * @param transmitEnabled PTT
 * @param connected       adapter link / poll health
 * @param lastUpdateAt    last successful poll or confirmed write, {@link Instant#EPOCH} before any
 */
public record RadioSnapshot(
        long frequencyHz,
        String mode,
        int passbandHz,
        boolean transmitEnabled,
        boolean connected,
        Instant lastUpdateAt) {
}
