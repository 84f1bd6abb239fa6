package com.example.boundary.audit.ledger;

import com.example.boundary.audit.document.AuditEntryDoc;
import com.example.boundary.audit.exception.TransientLedgerException;
import com.example.boundary.audit.model.AuditEntry;
import com.example.boundary.audit.repository.AuditEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Audit ledger on MongoDB. Entries are inserted, never saved over, so an existing id is never rewritten.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "boundary.audit.store", havingValue = "mongo")
public class MongoAuditLedger implements AuditLedger {

    private final AuditEntryRepository repository;

    @Override
    public Mono<Boolean> append(@NonNull AuditEntry entry) {
        return repository.insert(AuditEntryDoc.fromEntry(entry))
                .thenReturn(Boolean.TRUE)
                .onErrorResume(DuplicateKeyException.class, e -> {
                    // an earlier attempt landed before its acknowledgement was lost
                    log.debug("Audit entry {} already stored", entry.id());
                    return Mono.just(Boolean.FALSE);
                })
                .onErrorMap(DataAccessResourceFailureException.class,
                        e -> new TransientLedgerException("Audit store unreachable", e));
    }

    @Override
    public Flux<AuditEntry> findByResourceId(@NonNull String resourceId) {
        return repository.findByResourceIdOrderByTimestampAsc(resourceId).map(AuditEntryDoc::toEntry);
    }

    @Override
    public Flux<AuditEntry> findByUserId(@NonNull String userId) {
        return repository.findByUserIdOrderByTimestampAsc(userId).map(AuditEntryDoc::toEntry);
    }

    @Override
    public Flux<AuditEntry> findBetween(@NonNull Instant from, @NonNull Instant to) {
        return repository.findByTimestampGreaterThanEqualAndTimestampLessThanOrderByTimestampAsc(from, to)
                .map(AuditEntryDoc::toEntry);
    }
}
