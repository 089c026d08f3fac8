package com.hamclock.rigdaemon.dto;

/**
 * {@code {"error": message}}, the body of every failed request.
 */
public record ErrorResponse(String error) {

    public static ErrorResponse of(String message) {
        return new ErrorResponse(message != null ? message : "Unknown error");
    }
}
