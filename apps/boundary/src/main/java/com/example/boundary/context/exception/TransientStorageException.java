package com.example.boundary.context.exception;

/**
 * Thrown when the context store stays unavailable after bounded retries.
 */
public class TransientStorageException extends RuntimeException {

    public TransientStorageException(String message) {
        super(message);
    }

    public TransientStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
