package com.example.boundary.classifier.model;

import org.springframework.lang.NonNull;

/**
 * A detected identifier as a half-open character range. The matched text is deliberately not kept.
 */
public record DetectedSpan(
        @NonNull PhiCategory category,
        int start,
        int end
) {
    public DetectedSpan {
        if (category == null) {
            throw new IllegalArgumentException("category is required");
        }
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    public boolean overlaps(@NonNull DetectedSpan other) {
        return start < other.end && other.start < end;
    }
}
