package com.hamclock.rigdaemon.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * 🚨 Rig daemon failure carrying the HTTP status it maps to.
 *
 * Thrown (or used to complete futures exceptionally) by adapters and the control service;
 * {@link GlobalExceptionHandler} turns it into {@code {"error": message}}.
 */
@Getter
public class RigDaemonException extends RuntimeException {

    private final String errorCode;
    private final HttpStatus httpStatus;

    // 🏗️ Core Constructors

    public RigDaemonException(String message, String errorCode, HttpStatus httpStatus) {
        super(message);
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
    }

    public RigDaemonException(String message, Throwable cause, String errorCode, HttpStatus httpStatus) {
        super(message, cause);
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
    }

    // 🏭 Static Factory Methods

    public static RigDaemonException badRequest(String message) {
        return new RigDaemonException(message, "BAD_REQUEST", HttpStatus.BAD_REQUEST);
    }

    public static RigDaemonException pttDisabled() {
        return new RigDaemonException("PTT disabled in configuration", "PTT_DISABLED", HttpStatus.FORBIDDEN);
    }

    public static RigDaemonException notConnected() {
        return new RigDaemonException("Not connected", "NOT_CONNECTED", HttpStatus.INTERNAL_SERVER_ERROR);
    }

    public static RigDaemonException connectionLost() {
        return new RigDaemonException("Connection lost", "CONNECTION_LOST", HttpStatus.INTERNAL_SERVER_ERROR);
    }

    public static RigDaemonException rigError(String details) {
        return new RigDaemonException(details, "RIG_ERROR", HttpStatus.INTERNAL_SERVER_ERROR);
    }

    public static RigDaemonException rigError(String details, Throwable cause) {
        return new RigDaemonException(details, cause, "RIG_ERROR", HttpStatus.INTERNAL_SERVER_ERROR);
    }

    public static RigDaemonException timeout(String command, long timeoutMs) {
        return new RigDaemonException(
            "No reply to '" + command + "' within " + timeoutMs + " ms", "TIMEOUT", HttpStatus.INTERNAL_SERVER_ERROR);
    }

    // 🔍 Utility Methods

    /**
     * 🧅 Strips {@link CompletionException} / {@link ExecutionException} wrappers added by futures
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * 🎯 Gets the HTTP status code as integer
     */
    public int getStatusCode() {
        return httpStatus.value();
    }
}
