package com.hamclock.rigdaemon.adapter;

import java.util.concurrent.CompletableFuture;

/**
 * Capability set every rig-control backend provides. Exactly one implementation is selected at
 * startup from {@code rig.radio.type} and used for the lifetime of the process.
 * <p>
 * Write operations complete when the backend has confirmed (or rejected) the change; they never
 * update the shared state optimistically, except where noted by an implementation.
 */
public interface RadioAdapter {

    /**
     * Open the link to the backend. Failures are handled inside the adapter (reconnect or retry on
     * the next poll), never thrown.
     */
    void connect();

    /**
     * Send one raw backend command and complete with the backend's raw reply.
     */
    CompletableFuture<String> sendCommand(String command);

    CompletableFuture<Void> setFrequency(long frequencyHz);

    /**
     * @param passbandHz filter width, {@code 0} for the backend default; ignored by backends without one
     */
    CompletableFuture<Void> setMode(String mode, int passbandHz);

    CompletableFuture<Void> setPTT(boolean transmit);

    /**
     * Start an antenna-tuner cycle. Completes when the cycle (or its fallback) has finished.
     */
    CompletableFuture<Void> tune();
}
