package com.example.boundary.merge.exception;

/**
 * Thrown when a couple lock could not be acquired within the configured wait.
 */
public class LockTimeoutException extends RuntimeException {

    public LockTimeoutException(String key) {
        super("Timed out waiting for lock on " + key);
    }
}
