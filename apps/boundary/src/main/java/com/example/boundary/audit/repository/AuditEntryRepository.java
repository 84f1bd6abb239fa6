package com.example.boundary.audit.repository;

import com.example.boundary.audit.document.AuditEntryDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.time.Instant;

/**
 * Repository for audit entries. Callers must only use {@code insert}.
 */
@Repository
public interface AuditEntryRepository extends ReactiveMongoRepository<AuditEntryDoc, String> {

    Flux<AuditEntryDoc> findByResourceIdOrderByTimestampAsc(String resourceId);

    Flux<AuditEntryDoc> findByUserIdOrderByTimestampAsc(String userId);

    /**
     * Lower bound inclusive, upper bound exclusive.
     */
    Flux<AuditEntryDoc> findByTimestampGreaterThanEqualAndTimestampLessThanOrderByTimestampAsc(
            Instant from,
            Instant to);
}
