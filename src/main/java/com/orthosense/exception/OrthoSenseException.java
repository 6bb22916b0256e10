package com.orthosense.exception;

/**
 * Base exception for all OrthoSense application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class OrthoSenseException extends RuntimeException {

    public OrthoSenseException(String message) {
        super(message);
    }

    public OrthoSenseException(String message, Throwable cause) {
        super(message, cause);
    }

    public OrthoSenseException(Throwable cause) {
        super(cause);
    }
}
