package com.example.boundary.identity.model;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.Set;

/**
 * Authenticated caller as asserted by the identity gateway.
 *
 * @param userId            therapist or officer id
 * @param role              caller role
 * @param assignedClientIds client contexts the caller is assigned to
 * @param ipAddress         resolved client IP
 * @param userAgent         sanitized user agent, if sent
 * @param correlationId     request correlation id
 */
public record Actor(
        @NonNull String userId,
        @NonNull Role role,
        @NonNull Set<String> assignedClientIds,
        @NonNull String ipAddress,
        @Nullable String userAgent,
        @Nullable String correlationId
) {
    public static final String EXCHANGE_ATTRIBUTE = Actor.class.getName();

    public Actor {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        if (role == null) {
            throw new IllegalArgumentException("role is required");
        }
        assignedClientIds = assignedClientIds == null ? Set.of() : Set.copyOf(assignedClientIds);
        if (ipAddress == null || ipAddress.isBlank()) {
            ipAddress = "unknown";
        }
    }

    public boolean isAssignedTo(@NonNull String clientId) {
        return assignedClientIds.contains(clientId);
    }

    public boolean isTherapist() {
        return role == Role.THERAPIST;
    }

    public boolean isComplianceOfficer() {
        return role == Role.COMPLIANCE_OFFICER;
    }
}
