package com.example.boundary.audit.service;

import com.example.boundary.audit.exception.AuditWriteException;
import com.example.boundary.audit.ledger.AuditLedger;
import com.example.boundary.audit.model.AuditEntry;
import com.example.boundary.audit.model.AuditRequest;
import com.example.boundary.common.util.RetryUtils;
import com.example.boundary.common.util.StringSanitizer;
import com.example.boundary.config.BoundaryProperties;
import com.example.boundary.observability.metrics.BoundaryMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Instant;
import java.util.UUID;

/**
 * Writes audit entries to the ledger and mirrors them as structured JSON on the {@code PHI_AUDIT} logger.
 *
 * <p>A gated decision is final only once {@link #append} has completed. Each write is bounded by a
 * timeout and retried with backoff; the entry id is fixed before the first attempt so a write that
 * landed without acknowledgement is not duplicated by the retry. When retries run out the returned
 * Mono fails with {@link AuditWriteException} and the caller must abandon its decision.
 */
@Slf4j
@Service
public class AuditRecorder {

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("PHI_AUDIT");

    private final AuditLedger ledger;
    private final MonotonicClock clock;
    private final ObjectMapper objectMapper;
    private final BoundaryMetrics metrics;
    private final BoundaryProperties.Audit config;

    public AuditRecorder(
            @NonNull AuditLedger ledger,
            @NonNull MonotonicClock clock,
            @NonNull ObjectMapper objectMapper,
            @NonNull BoundaryMetrics metrics,
            @NonNull BoundaryProperties properties) {
        this.ledger = ledger;
        this.clock = clock;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.config = properties.getAudit();
    }

    /**
     * Appends one entry.
     *
     * @return the id of the stored entry
     */
    public Mono<String> append(@NonNull AuditRequest request) {
        return Mono.defer(() -> {
            AuditEntry entry = AuditEntry.from(request, UUID.randomUUID().toString(), clock.next());

            return Mono.defer(() -> ledger.append(entry))
                    .timeout(config.getTimeout())
                    .retryWhen(Retry.backoff(Math.max(0, config.getMaxAttempts() - 1), config.getInitialBackoff())
                            .maxBackoff(config.getMaxBackoff())
                            .filter(RetryUtils::isRetryable)
                            .doBeforeRetry(signal -> {
                                metrics.recordAuditRetry();
                                log.warn("Retrying audit write {}, attempt {}: {}",
                                        entry.id(), signal.totalRetries() + 2,
                                        StringSanitizer.forLog(signal.failure().getMessage()));
                            })
                            .onRetryExhaustedThrow((spec, signal) -> new AuditWriteException(
                                    "Audit write failed after " + (signal.totalRetries() + 1) + " attempts",
                                    signal.failure())))
                    .onErrorMap(e -> !(e instanceof AuditWriteException),
                            e -> new AuditWriteException("Audit write failed", e))
                    .doOnError(e -> {
                        metrics.recordAuditWrite(false);
                        log.error("Audit write failed for {} {} on {}: {}",
                                entry.action().value(), entry.result().value(),
                                StringSanitizer.forLog(entry.resourceId()),
                                StringSanitizer.forLog(e.getMessage()));
                    })
                    .doOnNext(inserted -> {
                        metrics.recordAuditWrite(true);
                        logEntry(entry);
                    })
                    .thenReturn(entry.id());
        });
    }

    public Flux<AuditEntry> findByResourceId(@NonNull String resourceId) {
        return ledger.findByResourceId(resourceId);
    }

    public Flux<AuditEntry> findByActor(@NonNull String userId) {
        return ledger.findByUserId(userId);
    }

    public Flux<AuditEntry> findBetween(@NonNull Instant from, @NonNull Instant to) {
        if (!from.isBefore(to)) {
            return Flux.error(new IllegalArgumentException("Audit range start must be before end"));
        }
        return ledger.findBetween(from, to);
    }

    private void logEntry(@NonNull AuditEntry entry) {
        try {
            String json = objectMapper.writeValueAsString(entry.toStructuredLog());
            if (entry.isSuccess()) {
                AUDIT_LOG.info(json);
            } else {
                AUDIT_LOG.warn(json);
            }
        } catch (JsonProcessingException e) {
            AUDIT_LOG.error("Failed to serialize audit entry: {}", StringSanitizer.forLog(e.getMessage()));
            logFallback(entry);
        }
    }

    private void logFallback(@NonNull AuditEntry entry) {
        AUDIT_LOG.warn("Audit {} {} - id={}, user={}, resource={}/{}",
                entry.action().value(),
                entry.result().value(),
                entry.id(),
                StringSanitizer.forLog(entry.userId()),
                StringSanitizer.forLog(entry.resourceType()),
                StringSanitizer.forLog(entry.resourceId()));
    }
}
