package com.example.boundary.merge.model;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

/**
 * Terminal outcome of a merge. A view is present only for {@link MergeState#COMPLETED}.
 */
public record MergeResult(
        @NonNull String coupleId,
        @NonNull MergeState state,
        @Nullable MergedFrameworkView view,
        @Nullable String reasonCode,
        @NonNull String auditEntryId
) {
    public MergeResult {
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("Merge result needs a terminal state, got " + state);
        }
        if ((state == MergeState.COMPLETED) != (view != null)) {
            throw new IllegalArgumentException("Only completed merges carry a view");
        }
    }

    public static MergeResult completed(@NonNull MergedFrameworkView view, @NonNull String auditEntryId) {
        return new MergeResult(view.coupleId(), MergeState.COMPLETED, view, null, auditEntryId);
    }

    public static MergeResult rejected(@NonNull String coupleId, @NonNull String reasonCode, @NonNull String auditEntryId) {
        return new MergeResult(coupleId, MergeState.REJECTED, null, reasonCode, auditEntryId);
    }

    public static MergeResult failed(@NonNull String coupleId, @NonNull String reasonCode, @NonNull String auditEntryId) {
        return new MergeResult(coupleId, MergeState.FAILED, null, reasonCode, auditEntryId);
    }

    public boolean isCompleted() {
        return state == MergeState.COMPLETED;
    }
}
