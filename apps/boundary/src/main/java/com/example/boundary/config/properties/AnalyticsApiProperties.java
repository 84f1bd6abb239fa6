package com.example.boundary.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.lang.NonNull;

import java.time.Duration;

/**
 * Configuration properties for the third-party analytical service.
 * Calls are never retried.
 */
@ConfigurationProperties(prefix = "boundary.analytics")
public record AnalyticsApiProperties(
        @NonNull String baseUrl,
        @NonNull String queryPath,
        @NonNull Duration timeout
) {
    public AnalyticsApiProperties {
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = "http://localhost:8091";
        }
        if (queryPath == null || queryPath.isBlank()) {
            queryPath = "/v1/query";
        }
        if (timeout == null) {
            timeout = Duration.ofSeconds(15);
        }
    }
}
