package com.example.boundary.audit.ledger;

import com.example.boundary.audit.model.AuditEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

@Slf4j
@Component
@ConditionalOnProperty(name = "boundary.audit.store", havingValue = "in-memory", matchIfMissing = true)
public class InMemoryAuditLedger implements AuditLedger {

    private static final Comparator<AuditEntry> BY_TIME =
            Comparator.comparing(AuditEntry::timestamp).thenComparing(AuditEntry::id);

    private final ConcurrentHashMap<String, AuditEntry> entries = new ConcurrentHashMap<>();

    public InMemoryAuditLedger() {
        log.info("Initialized in-memory audit ledger");
    }

    @Override
    public Mono<Boolean> append(@NonNull AuditEntry entry) {
        return Mono.fromSupplier(() -> entries.putIfAbsent(entry.id(), entry) == null);
    }

    @Override
    public Flux<AuditEntry> findByResourceId(@NonNull String resourceId) {
        return select(entry -> entry.resourceId().equals(resourceId));
    }

    @Override
    public Flux<AuditEntry> findByUserId(@NonNull String userId) {
        return select(entry -> entry.userId().equals(userId));
    }

    @Override
    public Flux<AuditEntry> findBetween(@NonNull Instant from, @NonNull Instant to) {
        return select(entry -> !entry.timestamp().isBefore(from) && entry.timestamp().isBefore(to));
    }

    public int size() {
        return entries.size();
    }

    @NonNull
    public List<AuditEntry> snapshot() {
        return entries.values().stream().sorted(BY_TIME).toList();
    }

    private Flux<AuditEntry> select(Predicate<AuditEntry> filter) {
        return Flux.defer(() -> Flux.fromIterable(entries.values().stream()
                .filter(filter)
                .sorted(BY_TIME)
                .toList()));
    }
}
