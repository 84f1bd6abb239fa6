package com.example.boundary.query.exception;

import lombok.Getter;

/**
 * Thrown when the external analytical service fails, times out or returns a non-2xx status.
 * Never retried.
 */
@Getter
public class ExternalServiceException extends RuntimeException {

    private final String serviceName;
    private final int statusCode;

    public ExternalServiceException(String serviceName, int statusCode, String message) {
        super(String.format("%s returned %d: %s", serviceName, statusCode, message));
        this.serviceName = serviceName;
        this.statusCode = statusCode;
    }

    public ExternalServiceException(String serviceName, Throwable cause) {
        super(String.format("%s call failed: %s", serviceName, cause.getClass().getSimpleName()), cause);
        this.serviceName = serviceName;
        this.statusCode = -1;
    }
}
