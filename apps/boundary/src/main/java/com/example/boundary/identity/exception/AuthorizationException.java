package com.example.boundary.identity.exception;

import lombok.Getter;

/**
 * Thrown when an authenticated actor may not act on a resource.
 * The reason code is safe to return to callers and to write to the audit trail.
 */
@Getter
public class AuthorizationException extends RuntimeException {

    private final String reasonCode;

    public AuthorizationException(String reasonCode, String message) {
        super(message);
        this.reasonCode = reasonCode;
    }
}
