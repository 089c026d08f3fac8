package com.hamclock.rigdaemon.helper;

import com.hamclock.rigdaemon.dto.RigEvent;

import java.io.IOException;

/**
 * One open event-stream client.
 */
public interface Subscriber {

    String id();

    /**
     * Deliver an event to the client.
     *
     * @throws IOException when the client connection is gone
     */
    void send(RigEvent event) throws IOException;

    /**
     * End the client connection. Called once the subscriber is dropped.
     */
    default void close() {
    }
}
