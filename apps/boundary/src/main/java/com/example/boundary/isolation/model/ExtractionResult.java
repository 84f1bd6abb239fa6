package com.example.boundary.isolation.model;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Outcome of an extraction. Every result has been audited under {@code auditEntryId}.
 */
public record ExtractionResult(
        @NonNull Outcome outcome,
        @Nullable AbstractedView view,
        @Nullable String reasonCode,
        @NonNull List<String> offendingFields,
        @NonNull String auditEntryId
) {
    public enum Outcome {
        EXTRACTED,
        POLICY_VIOLATION,
        DENIED,
        NOT_FOUND
    }

    public ExtractionResult {
        offendingFields = offendingFields == null ? List.of() : List.copyOf(offendingFields);
    }

    public static ExtractionResult extracted(@NonNull AbstractedView view, @NonNull String auditEntryId) {
        return new ExtractionResult(Outcome.EXTRACTED, view, null, List.of(), auditEntryId);
    }

    public static ExtractionResult violation(
            @NonNull String reasonCode, @NonNull List<String> offendingFields, @NonNull String auditEntryId) {
        return new ExtractionResult(Outcome.POLICY_VIOLATION, null, reasonCode, offendingFields, auditEntryId);
    }

    public static ExtractionResult denied(@NonNull String reasonCode, @NonNull String auditEntryId) {
        return new ExtractionResult(Outcome.DENIED, null, reasonCode, List.of(), auditEntryId);
    }

    public static ExtractionResult notFound(@NonNull String auditEntryId) {
        return new ExtractionResult(Outcome.NOT_FOUND, null, "CONTEXT_NOT_FOUND", List.of(), auditEntryId);
    }
}
