package com.example.boundary.context.model;

/**
 * Sensitivity tag carried by every client context field.
 */
public enum Sensitivity {
    PHI_CRITICAL,   // direct identifiers, raw clinical notes
    PHI_SENSITIVE,  // clinical detail traceable to the client
    PHI_DERIVED,    // categorical abstractions of clinical data
    INTERNAL;       // operational metadata

    /**
     * Restricted fields may only leave the store through a same-client policy that names them.
     */
    public boolean isRestricted() {
        return this == PHI_CRITICAL || this == PHI_SENSITIVE;
    }
}
