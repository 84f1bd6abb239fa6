package com.example.boundary.isolation.model;

/**
 * Where the projected view is allowed to go.
 */
public enum PolicyScope {
    SAME_CLIENT,
    COUPLES,
    EXTERNAL;

    /**
     * Only views that stay with the same client may carry PHI_CRITICAL or PHI_SENSITIVE fields.
     */
    public boolean allowsRestrictedFields() {
        return this == SAME_CLIENT;
    }
}
