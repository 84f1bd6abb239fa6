package com.example.boundary.identity.model;

import org.springframework.lang.Nullable;

import java.util.Arrays;
import java.util.Optional;

public enum Role {
    THERAPIST,
    COMPLIANCE_OFFICER;

    public static Optional<Role> fromHeader(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase().replace("-", "_");
        return Arrays.stream(values())
                .filter(role -> role.name().equals(normalized))
                .findFirst();
    }
}
