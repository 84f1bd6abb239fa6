package com.example.boundary.context.store;

import com.example.boundary.context.exception.ContextNotFoundException;
import com.example.boundary.context.model.ClientContext;
import com.example.boundary.context.model.CoupleLink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Context store kept in process memory. Every stored version stays readable.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "boundary.context-store.type", havingValue = "in-memory", matchIfMissing = true)
public class InMemoryContextStore implements ContextStoreClient {

    private final Map<String, NavigableMap<Long, ClientContext>> contexts = new ConcurrentHashMap<>();
    private final Map<String, CoupleLink> coupleLinks = new ConcurrentHashMap<>();

    public InMemoryContextStore() {
        log.info("Initialized in-memory context store");
    }

    @Override
    public Mono<ClientContext> getContext(@NonNull String clientId, @Nullable Long version) {
        return Mono.fromCallable(() -> {
            NavigableMap<Long, ClientContext> versions = contexts.get(clientId);
            if (versions == null || versions.isEmpty()) {
                throw new ContextNotFoundException("client_context", clientId);
            }
            ClientContext context = version == null ? versions.lastEntry().getValue() : versions.get(version);
            if (context == null) {
                throw new ContextNotFoundException("client_context", clientId + "@" + version);
            }
            return context;
        });
    }

    @Override
    public Mono<CoupleLink> getCoupleLink(@NonNull String coupleId) {
        return Mono.fromCallable(() -> {
            CoupleLink link = coupleLinks.get(coupleId);
            if (link == null) {
                throw new ContextNotFoundException("couple_link", coupleId);
            }
            return link;
        });
    }

    public void putContext(@NonNull ClientContext context) {
        contexts.computeIfAbsent(context.clientId(), id -> new ConcurrentSkipListMap<>())
                .put(context.version(), context);
        log.debug("Stored context {} version {}", context.clientId(), context.version());
    }

    public void putCoupleLink(@NonNull CoupleLink link) {
        coupleLinks.put(link.coupleId(), link);
        log.debug("Stored couple link {}", link.coupleId());
    }

    public void clear() {
        contexts.clear();
        coupleLinks.clear();
    }
}
