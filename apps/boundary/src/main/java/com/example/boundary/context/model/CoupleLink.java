package com.example.boundary.context.model;

import org.springframework.lang.NonNull;

/**
 * Link between two partner contexts under one therapist.
 * Partner ids are kept in lexicographic order so a couple has one canonical form.
 */
public record CoupleLink(
        @NonNull String coupleId,
        @NonNull String partnerAContextId,
        @NonNull String partnerBContextId,
        @NonNull String therapistId,
        @NonNull CoupleLinkStatus status
) {
    public CoupleLink {
        requireText(coupleId, "coupleId");
        requireText(partnerAContextId, "partnerAContextId");
        requireText(partnerBContextId, "partnerBContextId");
        requireText(therapistId, "therapistId");
        if (partnerAContextId.equals(partnerBContextId)) {
            throw new IllegalArgumentException("Couple partners must be different clients");
        }
        if (partnerAContextId.compareTo(partnerBContextId) > 0) {
            String swap = partnerAContextId;
            partnerAContextId = partnerBContextId;
            partnerBContextId = swap;
        }
        if (status == null) {
            status = CoupleLinkStatus.ACTIVE;
        }
    }

    public boolean isActive() {
        return status == CoupleLinkStatus.ACTIVE;
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
