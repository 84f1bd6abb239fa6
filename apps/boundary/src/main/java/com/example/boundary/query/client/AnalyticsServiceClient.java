package com.example.boundary.query.client;

import reactor.core.publisher.Mono;

/**
 * Third-party analytical service. Only text approved by the anonymization gate may be passed here.
 */
public interface AnalyticsServiceClient {

    /**
     * Sends one query and returns the service's answer text.
     */
    Mono<String> query(String text);
}
