package com.example.boundary.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.lang.NonNull;

import java.time.Duration;

/**
 * Configuration properties for the client context store.
 * The in-memory store is used unless {@code type} is {@code remote}.
 */
@ConfigurationProperties(prefix = "boundary.context-store")
public record ContextStoreProperties(
        @NonNull String type,
        @NonNull String baseUrl,
        @NonNull Duration timeout,
        @NonNull RetryProperties retry
) {
    public ContextStoreProperties {
        if (type == null || type.isBlank()) {
            type = "in-memory";
        }
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = "http://localhost:8090";
        }
        if (timeout == null) {
            timeout = Duration.ofSeconds(3);
        }
        if (retry == null) {
            retry = new RetryProperties(3, Duration.ofMillis(100), Duration.ofSeconds(2));
        }
    }

    /**
     * Retry configuration for context store reads.
     */
    public record RetryProperties(
            int maxAttempts,
            @NonNull Duration initialBackoff,
            @NonNull Duration maxBackoff
    ) {
        public RetryProperties {
            if (maxAttempts <= 0) {
                maxAttempts = 3;
            }
            if (initialBackoff == null) {
                initialBackoff = Duration.ofMillis(100);
            }
            if (maxBackoff == null) {
                maxBackoff = Duration.ofSeconds(2);
            }
        }
    }
}
