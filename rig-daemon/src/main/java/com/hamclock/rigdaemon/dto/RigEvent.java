package com.hamclock.rigdaemon.dto;

/**
 * Payload of one event-stream message. Serialized to JSON as the {@code data:} line.
 */
public interface RigEvent {

    String type();
}
