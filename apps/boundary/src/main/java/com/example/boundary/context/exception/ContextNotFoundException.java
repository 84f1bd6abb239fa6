package com.example.boundary.context.exception;

import lombok.Getter;

/**
 * Thrown when a client context, context version or couple link does not exist.
 */
@Getter
public class ContextNotFoundException extends RuntimeException {

    private final String resourceType;
    private final String resourceId;

    public ContextNotFoundException(String resourceType, String resourceId) {
        super(resourceType + " not found");
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }
}
