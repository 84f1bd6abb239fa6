package com.example.boundary.audit.exception;

/**
 * Thrown when an audit entry could not be persisted. The enclosing decision must not be returned.
 */
public class AuditWriteException extends RuntimeException {

    public AuditWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
