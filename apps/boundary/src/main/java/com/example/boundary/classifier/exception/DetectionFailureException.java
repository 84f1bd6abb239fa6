package com.example.boundary.classifier.exception;

/**
 * Raised when text cannot be scanned reliably. Treated exactly like a positive detection.
 */
public class DetectionFailureException extends RuntimeException {

    public DetectionFailureException(String message) {
        super(message);
    }

    public DetectionFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
