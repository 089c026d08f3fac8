package com.hamclock.rigdaemon.exception;

import com.hamclock.rigdaemon.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.async.AsyncRequestNotUsableException;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * 🛡️ Global Exception Handler for the rig daemon
 *
 * Every failure leaves the API as {@code {"error": message}}:
 * - {@link RigDaemonException} with the status it carries (403 PTT gate, 500 rig/link errors)
 * - validation and unreadable bodies as 400
 * - anything else as 500; the daemon keeps running
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    // 🔧 Custom Application Exceptions

    @ExceptionHandler(RigDaemonException.class)
    public ResponseEntity<ErrorResponse> handleRigDaemonException(RigDaemonException ex, HttpServletRequest request) {
        if (ex.getHttpStatus().is5xxServerError()) {
            log.error("🚨 Rig error at {}: {}", request.getRequestURI(), ex.getMessage());
        } else {
            log.warn("⚠️ Request refused at {}: {}", request.getRequestURI(), ex.getMessage());
        }
        return ResponseEntity.status(ex.getHttpStatus()).body(ErrorResponse.of(ex.getMessage()));
    }

    /**
     * ⚡ Future wrappers around adapter failures
     */
    @ExceptionHandler({CompletionException.class, ExecutionException.class})
    public ResponseEntity<ErrorResponse> handleWrappedException(Exception ex, HttpServletRequest request) {
        Throwable cause = RigDaemonException.unwrap(ex);
        if (cause instanceof RigDaemonException rigException) {
            return handleRigDaemonException(rigException, request);
        }
        log.error("🌐 Unexpected async error at {}: {}", request.getRequestURI(), cause.getMessage(), cause);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.of(cause.getMessage()));
    }

    // 🔍 Validation Errors

    /**
     * 📝 Handles validation errors from @Valid annotations
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationError(MethodArgumentNotValidException ex,
                                                               HttpServletRequest request) {
        String validationMessage = ex.getBindingResult().getAllErrors().stream()
            .map(error -> error.getDefaultMessage())
            .reduce((a, b) -> a + "; " + b)
            .orElse("Validation failed");

        log.warn("📝 Validation error at {}: {}", request.getRequestURI(), validationMessage);
        return ResponseEntity.badRequest().body(ErrorResponse.of(validationMessage));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex,
                                                              HttpServletRequest request) {
        log.warn("📝 Unreadable request body at {}: {}", request.getRequestURI(), ex.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.of("Malformed JSON request body"));
    }

    // 🚨 Generic Exception Handlers

    /**
     * 📡 Stream client went away mid-write; nothing can be sent back
     */
    @ExceptionHandler(AsyncRequestNotUsableException.class)
    public void handleClientGone(AsyncRequestNotUsableException ex) {
        log.debug("📭 Client disconnected: {}", ex.getMessage());
    }

    /**
     * 🌐 Catches all other exceptions
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, HttpServletRequest request) {
        log.error("🌐 Unexpected error at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.of(ex.getMessage()));
    }
}
