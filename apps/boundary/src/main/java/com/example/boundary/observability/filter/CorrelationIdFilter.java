package com.example.boundary.observability.filter;

import com.example.boundary.common.util.StringSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.UUID;

/**
 * Gives every request a correlation id, echoed on the response and carried in MDC
 * and the Reactor context so audit entries can be tied back to the request.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter implements WebFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String CORRELATION_ID_KEY = "correlationId";
    public static final String REQUEST_PATH_KEY = "requestPath";
    public static final String REQUEST_METHOD_KEY = "requestMethod";
    private static final int MAX_CORRELATION_ID_LENGTH = 64;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String correlationId = resolveCorrelationId(exchange.getRequest());
        String requestPath = exchange.getRequest().getPath().value();
        String requestMethod = exchange.getRequest().getMethod().name();

        exchange.getResponse().getHeaders().set(CORRELATION_ID_HEADER, correlationId);

        ServerHttpRequest mutatedRequest = exchange.getRequest().mutate()
                .headers(headers -> headers.set(CORRELATION_ID_HEADER, correlationId))
                .build();

        return chain.filter(exchange.mutate().request(mutatedRequest).build())
                .contextWrite(Context.of(
                        CORRELATION_ID_KEY, correlationId,
                        REQUEST_PATH_KEY, requestPath,
                        REQUEST_METHOD_KEY, requestMethod
                ))
                .doFirst(() -> {
                    MDC.put(CORRELATION_ID_KEY, correlationId);
                    MDC.put(REQUEST_PATH_KEY, requestPath);
                    MDC.put(REQUEST_METHOD_KEY, requestMethod);
                    log.debug("Request started: {} {}", requestMethod, StringSanitizer.forLog(requestPath, 200));
                })
                .doFinally(signalType -> {
                    log.debug("Request completed: {} {} - {}", requestMethod,
                            StringSanitizer.forLog(requestPath, 200), signalType);
                    MDC.remove(CORRELATION_ID_KEY);
                    MDC.remove(REQUEST_PATH_KEY);
                    MDC.remove(REQUEST_METHOD_KEY);
                });
    }

    /**
     * X-Correlation-Id first, then X-Request-Id, else a fresh UUID.
     * Ids that are too long or carry unsafe characters are replaced.
     */
    private String resolveCorrelationId(ServerHttpRequest request) {
        for (String header : new String[] {CORRELATION_ID_HEADER, REQUEST_ID_HEADER}) {
            String value = request.getHeaders().getFirst(header);
            if (value != null && !value.isBlank()) {
                String trimmed = value.trim();
                if (trimmed.length() <= MAX_CORRELATION_ID_LENGTH && trimmed.matches("^[a-zA-Z0-9_-]+$")) {
                    return trimmed;
                }
            }
        }
        return UUID.randomUUID().toString();
    }
}
