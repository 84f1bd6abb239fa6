package com.example.boundary.query.model;

import com.example.boundary.classifier.model.BlockReason;
import com.example.boundary.classifier.model.PhiCategory;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Outcome of one sanitize-and-query call. Blocked results never carry a response, and never echo
 * the submitted text.
 */
public record QueryResult(
        @NonNull Outcome outcome,
        @Nullable String response,
        @Nullable BlockReason reason,
        @NonNull List<PhiCategory> detectedCategories,
        @NonNull String requestId,
        @NonNull String auditEntryId
) {
    public enum Outcome {
        ALLOWED,
        BLOCKED
    }

    public static QueryResult allowed(@NonNull String response, @NonNull String requestId, @NonNull String auditEntryId) {
        return new QueryResult(Outcome.ALLOWED, response, null, List.of(), requestId, auditEntryId);
    }

    public static QueryResult blocked(
            @NonNull BlockReason reason,
            @NonNull List<PhiCategory> categories,
            @NonNull String requestId,
            @NonNull String auditEntryId) {
        return new QueryResult(Outcome.BLOCKED, null, reason, List.copyOf(categories), requestId, auditEntryId);
    }

    public boolean isAllowed() {
        return outcome == Outcome.ALLOWED;
    }
}
