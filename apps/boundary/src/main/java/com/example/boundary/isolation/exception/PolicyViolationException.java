package com.example.boundary.isolation.exception;

import lombok.Getter;

import java.util.List;

/**
 * Thrown when a projection would cross a whitelist. Carries field names only, never values.
 */
@Getter
public class PolicyViolationException extends RuntimeException {

    private final String policyId;
    private final String reasonCode;
    private final List<String> offendingFields;

    public PolicyViolationException(String policyId, String reasonCode, List<String> offendingFields) {
        super("Policy " + policyId + " violated: " + reasonCode + " " + offendingFields);
        this.policyId = policyId;
        this.reasonCode = reasonCode;
        this.offendingFields = List.copyOf(offendingFields);
    }

    public static PolicyViolationException unknownPolicy(String policyId) {
        return new PolicyViolationException(policyId, "UNKNOWN_POLICY", List.of());
    }

    public static PolicyViolationException inactivePolicy(String policyId) {
        return new PolicyViolationException(policyId, "INACTIVE_POLICY", List.of());
    }
}
