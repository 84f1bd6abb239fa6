package com.example.boundary.audit.model;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable record of one boundary-crossing decision.
 */
public record AuditEntry(
        @NonNull String id,
        @NonNull Instant timestamp,
        @NonNull String eventType,
        @NonNull String userId,
        @NonNull String actorRole,
        @NonNull AuditAction action,
        @NonNull String resourceType,
        @NonNull String resourceId,
        @NonNull AuditResult result,
        @NonNull String ipAddress,
        @Nullable String userAgent,
        @Nullable String correlationId,
        @NonNull Map<String, Object> details
) {
    public AuditEntry {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    @NonNull
    public static AuditEntry from(@NonNull AuditRequest request, @NonNull String id, @NonNull Instant timestamp) {
        return new AuditEntry(
                id,
                timestamp,
                request.eventType(),
                request.actor().userId(),
                request.actor().role().name(),
                request.action(),
                request.resourceType(),
                request.resourceId(),
                request.result(),
                request.actor().ipAddress(),
                request.actor().userAgent(),
                request.actor().correlationId(),
                request.details()
        );
    }

    public boolean isSuccess() {
        return result == AuditResult.SUCCESS;
    }

    /**
     * Flat map in the persisted audit schema, for JSON logging.
     */
    @NonNull
    public Map<String, Object> toStructuredLog() {
        return Map.ofEntries(
                Map.entry("audit_id", id),
                Map.entry("timestamp", timestamp.toString()),
                Map.entry("event_type", eventType),
                Map.entry("user_id", userId),
                Map.entry("actor_role", actorRole),
                Map.entry("resource_type", resourceType),
                Map.entry("resource_id", resourceId),
                Map.entry("action", action.value()),
                Map.entry("result", result.value()),
                Map.entry("ip_address", ipAddress),
                Map.entry("user_agent", userAgent != null ? userAgent : ""),
                Map.entry("correlation_id", correlationId != null ? correlationId : ""),
                Map.entry("details", details)
        );
    }
}
