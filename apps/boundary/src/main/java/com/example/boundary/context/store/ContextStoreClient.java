package com.example.boundary.context.store;

import com.example.boundary.context.model.ClientContext;
import com.example.boundary.context.model.CoupleLink;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

/**
 * Read-only access to the context store.
 * Missing resources are signalled with {@code ContextNotFoundException}, never with an empty Mono.
 */
public interface ContextStoreClient {

    /**
     * Loads a client context.
     *
     * @param clientId the client context id
     * @param version  the version to load, or null for the latest
     */
    Mono<ClientContext> getContext(@NonNull String clientId, @Nullable Long version);

    Mono<CoupleLink> getCoupleLink(@NonNull String coupleId);
}
