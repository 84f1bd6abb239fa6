package com.example.boundary.identity.filter;

import com.example.boundary.common.util.ClientIpExtractor;
import com.example.boundary.common.util.StringSanitizer;
import com.example.boundary.identity.exception.AuthenticationException;
import com.example.boundary.identity.model.Actor;
import com.example.boundary.identity.model.Role;
import com.example.boundary.observability.filter.CorrelationIdFilter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the {@link Actor} for API requests from the headers set by the identity gateway.
 * Authentication itself happens upstream; this filter only refuses requests without a usable identity.
 */
@Slf4j
@Component
public class GatewayIdentityFilter implements WebFilter, Ordered {

    public static final String HEADER_THERAPIST_ID = "X-Therapist-Id";
    public static final String HEADER_ROLE = "X-Role";
    public static final String HEADER_ASSIGNED_CLIENTS = "X-Assigned-Clients";
    private static final String HEADER_USER_AGENT = "User-Agent";
    private static final String API_PREFIX = "/api/";
    private static final int MAX_USER_AGENT_LENGTH = 200;

    @Override
    public int getOrder() {
        return -100; // after correlation id, before handlers
    }

    @Override
    @NonNull
    public Mono<Void> filter(@NonNull ServerWebExchange exchange, @NonNull WebFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        if (!request.getPath().value().startsWith(API_PREFIX)) {
            return chain.filter(exchange);
        }

        String userId = StringSanitizer.headerValue(request.getHeaders().getFirst(HEADER_THERAPIST_ID));
        if (!StringSanitizer.isValidSafeId(userId)) {
            return Mono.error(new AuthenticationException("Missing or invalid header: " + HEADER_THERAPIST_ID));
        }

        Optional<Role> role = Role.fromHeader(request.getHeaders().getFirst(HEADER_ROLE));
        if (role.isEmpty()) {
            return Mono.error(new AuthenticationException("Missing or invalid header: " + HEADER_ROLE));
        }

        Set<String> assignedClients;
        try {
            assignedClients = parseAssignedClients(request.getHeaders().getFirst(HEADER_ASSIGNED_CLIENTS));
        } catch (IllegalArgumentException e) {
            return Mono.error(new AuthenticationException("Invalid header: " + HEADER_ASSIGNED_CLIENTS));
        }

        Actor actor = new Actor(
                userId,
                role.get(),
                assignedClients,
                ClientIpExtractor.extract(request),
                userAgent(request),
                request.getHeaders().getFirst(CorrelationIdFilter.CORRELATION_ID_HEADER));

        exchange.getAttributes().put(Actor.EXCHANGE_ATTRIBUTE, actor);
        log.debug("Gateway identity accepted: role={}, user={}, assignedClients={}",
                actor.role(), StringSanitizer.forLog(actor.userId()), assignedClients.size());
        return chain.filter(exchange);
    }

    /**
     * Parses the comma separated assigned-client header. An absent header means no assignments.
     */
    @NonNull
    static Set<String> parseAssignedClients(@Nullable String header) {
        if (header == null || header.isBlank()) {
            return Set.of();
        }
        Set<String> ids = Arrays.stream(header.split(","))
                .map(String::trim)
                .filter(id -> !id.isEmpty())
                .collect(Collectors.toSet());
        if (ids.stream().anyMatch(id -> !StringSanitizer.isValidSafeId(id))) {
            throw new IllegalArgumentException("Assigned client id has invalid characters");
        }
        return ids;
    }

    @Nullable
    private String userAgent(ServerHttpRequest request) {
        String value = StringSanitizer.headerValue(request.getHeaders().getFirst(HEADER_USER_AGENT));
        if (value == null || value.isBlank()) {
            return null;
        }
        return StringSanitizer.forLog(value, MAX_USER_AGENT_LENGTH);
    }
}
