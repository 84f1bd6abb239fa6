package com.example.boundary.isolation.model;

import org.springframework.lang.NonNull;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Named, versioned list of fields allowed across a trust boundary. Absence from the list means exclusion.
 */
public record WhitelistPolicy(
        @NonNull String id,
        int version,
        @NonNull PolicyMode mode,
        @NonNull PolicyScope scope,
        @NonNull Set<String> allowedFields,
        boolean active
) {
    public WhitelistPolicy {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Policy id is required");
        }
        if (version <= 0) {
            throw new IllegalArgumentException("Policy version must be positive: " + id);
        }
        if (mode == null || scope == null) {
            throw new IllegalArgumentException("Policy mode and scope are required: " + id);
        }
        if (scope != PolicyScope.SAME_CLIENT && mode != PolicyMode.STRICT) {
            throw new IllegalArgumentException("Policy " + id + " with scope " + scope + " must be STRICT");
        }
        if (allowedFields == null || allowedFields.isEmpty()) {
            throw new IllegalArgumentException("Policy " + id + " allows no fields");
        }
        allowedFields = Collections.unmodifiableSet(new TreeSet<>(allowedFields));
    }

    public boolean allows(@NonNull String field) {
        return allowedFields.contains(field);
    }

    public boolean isStrict() {
        return mode == PolicyMode.STRICT;
    }

    /**
     * True when every field of this policy is also in {@code other} and {@code other} has at least one more.
     */
    public boolean isStrictlyNarrowerThan(@NonNull WhitelistPolicy other) {
        return other.allowedFields.containsAll(allowedFields) && other.allowedFields.size() > allowedFields.size();
    }
}
