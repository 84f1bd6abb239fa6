package com.example.boundary.merge.model;

import org.springframework.lang.NonNull;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Therapist-facing couples view. Every term comes from the category vocabulary; no partner's own
 * text is carried. Built per request and never cached.
 *
 * @param categories            category field name to the union of both partners' terms
 * @param sourceContextVersions partner context id to the context version used
 */
public record MergedFrameworkView(
        @NonNull String coupleId,
        @NonNull SortedMap<String, List<String>> categories,
        @NonNull List<TopicMatch> overlappingThemes,
        @NonNull List<TopicMatch> complementaryPatterns,
        @NonNull List<TopicMatch> potentialConflicts,
        @NonNull List<String> suggestedFocusAreas,
        @NonNull List<String> couplesExercises,
        @NonNull String matchSummary,
        @NonNull Map<String, Long> sourceContextVersions,
        @NonNull Instant createdAt
) {
    @NonNull
    public List<String> terms(@NonNull String category) {
        return categories.getOrDefault(category, List.of());
    }
}
