package com.example.boundary.classifier.model;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Allowed(text) or Blocked(reason, spans). Allowed text is returned exactly as given.
 */
public record SanitizeDecision(
        @NonNull Decision decision,
        @Nullable String text,
        @Nullable BlockReason reason,
        @NonNull List<DetectedSpan> spans
) {
    public enum Decision {
        ALLOWED,
        BLOCKED
    }

    public SanitizeDecision {
        spans = spans == null ? List.of() : List.copyOf(spans);
    }

    public static SanitizeDecision allowed(@NonNull String text) {
        return new SanitizeDecision(Decision.ALLOWED, text, null, List.of());
    }

    public static SanitizeDecision blocked(@NonNull BlockReason reason, @NonNull List<DetectedSpan> spans) {
        return new SanitizeDecision(Decision.BLOCKED, null, reason, spans);
    }

    public static SanitizeDecision detectionFailure() {
        return blocked(BlockReason.DETECTION_FAILURE, List.of());
    }

    public boolean isAllowed() {
        return decision == Decision.ALLOWED;
    }

    @NonNull
    public List<PhiCategory> categories() {
        return spans.stream().map(DetectedSpan::category).toList();
    }
}
