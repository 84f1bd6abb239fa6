package com.example.boundary.audit.model;

public enum AuditAction {
    EXTRACT("extract"),
    MERGE("merge"),
    SANITIZE("sanitize");

    private final String value;

    AuditAction(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
