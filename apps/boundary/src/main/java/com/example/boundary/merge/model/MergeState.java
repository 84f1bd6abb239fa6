package com.example.boundary.merge.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of one merge invocation. COMPLETED, REJECTED and FAILED are terminal.
 */
public enum MergeState {
    REQUESTED,
    AUTHORIZED,
    EXTRACTING_A,
    EXTRACTING_B,
    MERGING,
    COMPLETED,
    REJECTED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == REJECTED || this == FAILED;
    }

    public boolean canTransitionTo(MergeState next) {
        return successors().contains(next);
    }

    private Set<MergeState> successors() {
        return switch (this) {
            case REQUESTED -> EnumSet.of(AUTHORIZED, REJECTED, FAILED);
            case AUTHORIZED -> EnumSet.of(EXTRACTING_A, FAILED);
            case EXTRACTING_A -> EnumSet.of(EXTRACTING_B, FAILED);
            case EXTRACTING_B -> EnumSet.of(MERGING, FAILED);
            case MERGING -> EnumSet.of(COMPLETED, FAILED);
            case COMPLETED, REJECTED, FAILED -> EnumSet.noneOf(MergeState.class);
        };
    }
}
