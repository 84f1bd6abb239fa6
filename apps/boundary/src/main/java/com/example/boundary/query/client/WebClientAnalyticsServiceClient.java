package com.example.boundary.query.client;

import com.example.boundary.config.WebClientConfig;
import com.example.boundary.config.properties.AnalyticsApiProperties;
import com.example.boundary.query.exception.ExternalServiceException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Map;

@Slf4j
@Component
public class WebClientAnalyticsServiceClient implements AnalyticsServiceClient {

    static final String SERVICE_NAME = "analytics";

    private final WebClient webClient;
    private final AnalyticsApiProperties properties;

    public WebClientAnalyticsServiceClient(
            @Qualifier(WebClientConfig.ANALYTICS_WEBCLIENT) WebClient webClient,
            AnalyticsApiProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    @Override
    public Mono<String> query(String text) {
        return webClient.post()
                .uri(properties.queryPath())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("query", text))
                .retrieve()
                .onStatus(status -> !status.is2xxSuccessful(),
                        response -> Mono.error(new ExternalServiceException(
                                SERVICE_NAME, response.statusCode().value(), "Non-success response")))
                .bodyToMono(JsonNode.class)
                .map(WebClientAnalyticsServiceClient::extractAnswer)
                .timeout(properties.timeout())
                .onErrorMap(e -> !(e instanceof ExternalServiceException),
                        e -> new ExternalServiceException(SERVICE_NAME, e))
                .doOnError(e -> log.warn("Analytics query failed: {}", e.getMessage()));
    }

    private static String extractAnswer(JsonNode body) {
        JsonNode answer = body.path("response");
        if (answer.isMissingNode() || answer.isNull()) {
            answer = body.path("answer");
        }
        if (answer.isMissingNode() || answer.isNull()) {
            throw new ExternalServiceException(SERVICE_NAME, 200, "Response has no answer field");
        }
        return answer.asText();
    }
}
