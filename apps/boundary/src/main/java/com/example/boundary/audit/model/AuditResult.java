package com.example.boundary.audit.model;

public enum AuditResult {
    SUCCESS("success"),
    FAILURE("failure");

    private final String value;

    AuditResult(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
