package com.example.boundary.audit.model;

import com.example.boundary.identity.model.Actor;
import org.springframework.lang.NonNull;

import java.util.Map;
import java.util.Objects;

/**
 * A decision to be recorded. The recorder assigns id and timestamp.
 * Details must hold only identifiers, codes and counts, never context values or scanned text.
 */
public record AuditRequest(
        @NonNull Actor actor,
        @NonNull String eventType,
        @NonNull AuditAction action,
        @NonNull String resourceType,
        @NonNull String resourceId,
        @NonNull AuditResult result,
        @NonNull Map<String, Object> details
) {
    public AuditRequest {
        Objects.requireNonNull(actor, "actor");
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(resourceType, "resourceType");
        Objects.requireNonNull(resourceId, "resourceId");
        Objects.requireNonNull(result, "result");
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static AuditRequest success(
            @NonNull Actor actor,
            @NonNull String eventType,
            @NonNull AuditAction action,
            @NonNull String resourceType,
            @NonNull String resourceId,
            @NonNull Map<String, Object> details) {
        return new AuditRequest(actor, eventType, action, resourceType, resourceId, AuditResult.SUCCESS, details);
    }

    public static AuditRequest failure(
            @NonNull Actor actor,
            @NonNull String eventType,
            @NonNull AuditAction action,
            @NonNull String resourceType,
            @NonNull String resourceId,
            @NonNull Map<String, Object> details) {
        return new AuditRequest(actor, eventType, action, resourceType, resourceId, AuditResult.FAILURE, details);
    }
}
