package com.orthosense.presentation.exception;

import com.orthosense.exception.InvalidFrameException;
import com.orthosense.exception.UnknownExerciseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while keeping internal details away from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - malformed or invalid pose frames (HTTP 400).
     */
    @ExceptionHandler(InvalidFrameException.class)
    ResponseEntity<ApiError> handleInvalidFrame(InvalidFrameException ex) {
        LOG.warn("Invalid frame: index={}, reason={}", ex.getFrameIndex(), ex.getReason());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid pose data",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Client error - forced exercise outside the catalogue (HTTP 400).
     */
    @ExceptionHandler(UnknownExerciseException.class)
    ResponseEntity<ApiError> handleUnknownExercise(UnknownExerciseException ex) {
        LOG.warn("Unknown exercise requested: {}", ex.getRequested());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Unknown exercise",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
