package com.hamclock.rigdaemon.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Incremental change of a single radio property.
 *
 * @param prop  one of {@code freq}, {@code mode}, {@code width}, {@code ptt}, {@code connected}
 * @param value the new value
 */
@JsonPropertyOrder({"type", "prop", "value"})
public record UpdateEvent(String type, String prop, Object value) implements RigEvent {

    public static final String TYPE = "update";

    public static final String FREQ = "freq";
    public static final String MODE = "mode";
    public static final String WIDTH = "width";
    public static final String PTT = "ptt";
    public static final String CONNECTED = "connected";

    public static UpdateEvent of(String prop, Object value) {
        return new UpdateEvent(TYPE, prop, value);
    }
}
