package com.example.boundary.context.store;

import com.example.boundary.config.WebClientConfig;
import com.example.boundary.context.exception.ContextNotFoundException;
import com.example.boundary.context.model.ClientContext;
import com.example.boundary.context.model.ContextField;
import com.example.boundary.context.model.CoupleLink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Context store client backed by the context service HTTP API.
 * Retries and timeouts are applied by {@link ContextLoader}.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "boundary.context-store.type", havingValue = "remote")
public class RemoteContextStoreClient implements ContextStoreClient {

    private final WebClient webClient;

    public RemoteContextStoreClient(@Qualifier(WebClientConfig.CONTEXT_STORE_WEBCLIENT) WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public Mono<ClientContext> getContext(@NonNull String clientId, @Nullable Long version) {
        return webClient.get()
                .uri(builder -> {
                    builder.path("/contexts/{id}");
                    if (version != null) {
                        builder.queryParam("version", version);
                    }
                    return builder.build(clientId);
                })
                .retrieve()
                .bodyToMono(ContextPayload.class)
                .map(ContextPayload::toContext)
                .onErrorMap(WebClientResponseException.NotFound.class,
                        e -> new ContextNotFoundException("client_context", clientId));
    }

    @Override
    public Mono<CoupleLink> getCoupleLink(@NonNull String coupleId) {
        return webClient.get()
                .uri("/couples/{id}", coupleId)
                .retrieve()
                .bodyToMono(CoupleLink.class)
                .onErrorMap(WebClientResponseException.NotFound.class,
                        e -> new ContextNotFoundException("couple_link", coupleId));
    }

    record ContextPayload(
            String clientId,
            String therapistId,
            long version,
            List<ContextField> fields
    ) {
        ClientContext toContext() {
            return ClientContext.of(clientId, therapistId, version, fields == null ? List.of() : fields);
        }
    }
}
