package com.hamclock.rigdaemon.dto;

/**
 * {@code {"success": true}}
 */
public record SuccessResponse(boolean success) {

    private static final SuccessResponse OK = new SuccessResponse(true);

    public static SuccessResponse ok() {
        return OK;
    }
}
