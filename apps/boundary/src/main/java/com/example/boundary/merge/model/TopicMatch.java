package com.example.boundary.merge.model;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

/**
 * A theme or pattern relationship found between the two partners' abstracted views.
 */
public record TopicMatch(
        @NonNull String topic,
        @NonNull MatchType matchType,
        double confidence,
        @NonNull String description,
        @Nullable String focusArea
) {
    public enum MatchType {
        OVERLAP,
        COMPLEMENTARY,
        CONFLICT
    }
}
