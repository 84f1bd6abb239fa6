package com.example.boundary.identity.exception;

/**
 * Thrown when the gateway identity headers are missing or malformed.
 */
public class AuthenticationException extends RuntimeException {

    public AuthenticationException(String message) {
        super(message);
    }
}
