package com.example.boundary.audit.ledger;

import com.example.boundary.audit.model.AuditEntry;
import org.springframework.lang.NonNull;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Append-only store of audit entries. There is deliberately no update or delete operation.
 */
public interface AuditLedger {

    /**
     * Appends an entry. Appending an id that is already stored leaves the ledger unchanged.
     *
     * @return true if the entry was written, false if the id was already present
     */
    Mono<Boolean> append(@NonNull AuditEntry entry);

    Flux<AuditEntry> findByResourceId(@NonNull String resourceId);

    Flux<AuditEntry> findByUserId(@NonNull String userId);

    /**
     * Entries with {@code from <= timestamp < to}, oldest first.
     */
    Flux<AuditEntry> findBetween(@NonNull Instant from, @NonNull Instant to);
}
