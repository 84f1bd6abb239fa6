package com.example.boundary.query.dto;

import org.springframework.lang.Nullable;

/**
 * Outbound query body. Empty or missing text is not rejected here; the anonymization gate
 * blocks and audits it.
 */
public record OutboundQueryRequest(@Nullable String text) {
}
