package com.example.boundary.classifier.gate;

import com.example.boundary.audit.model.AuditAction;
import com.example.boundary.audit.model.AuditRequest;
import com.example.boundary.audit.service.AuditRecorder;
import com.example.boundary.classifier.detector.PhiDetector;
import com.example.boundary.classifier.exception.DetectionFailureException;
import com.example.boundary.classifier.model.BlockReason;
import com.example.boundary.classifier.model.DetectedSpan;
import com.example.boundary.classifier.model.SanitizeDecision;
import com.example.boundary.config.BoundaryProperties;
import com.example.boundary.identity.model.Actor;
import com.example.boundary.observability.metrics.BoundaryMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Approves or blocks text bound for a third-party service. There is no redact-and-continue path:
 * any detection blocks, and so does any failure to scan.
 */
@Slf4j
@Component
public class AnonymizationGate {

    static final String EVENT_TYPE = "outbound_sanitize";
    static final String RESOURCE_TYPE = "outbound_query";

    private final PhiDetector detector;
    private final AuditRecorder auditRecorder;
    private final BoundaryMetrics metrics;
    private final Duration scanTimeout;
    private final int maxInputLength;

    public AnonymizationGate(
            @NonNull PhiDetector detector,
            @NonNull AuditRecorder auditRecorder,
            @NonNull BoundaryMetrics metrics,
            @NonNull BoundaryProperties properties) {
        this.detector = detector;
        this.auditRecorder = auditRecorder;
        this.metrics = metrics;
        this.scanTimeout = properties.getClassifier().getScanTimeout();
        this.maxInputLength = properties.getClassifier().getMaxInputLength();
    }

    /**
     * Scans the text and audits the decision.
     *
     * @return the decision and the id of its audit entry
     */
    public Mono<AuditedDecision> sanitize(@Nullable String text, @NonNull Actor actor) {
        String requestId = "q-" + UUID.randomUUID();
        return scan(text)
                .flatMap(decision -> auditRecorder.append(toAuditRequest(decision, text, actor, requestId))
                        .map(auditId -> new AuditedDecision(decision, auditId, requestId)))
                .doOnNext(audited -> {
                    SanitizeDecision decision = audited.decision();
                    metrics.recordSanitize(decision.isAllowed(),
                            decision.reason() != null ? decision.reason().name() : null);
                    log.info("Outbound text {} ({}), spans={}", decision.decision(), requestId,
                            decision.categories());
                });
    }

    /**
     * Scan without auditing. Never errors: every failure becomes {@link BlockReason#DETECTION_FAILURE}.
     */
    public Mono<SanitizeDecision> scan(@Nullable String text) {
        return Mono.fromCallable(() -> classify(text))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(scanTimeout)
                .onErrorResume(e -> {
                    log.warn("PHI scan failed, blocking text: {}", e.getClass().getSimpleName());
                    return Mono.just(SanitizeDecision.detectionFailure());
                });
    }

    @NonNull
    SanitizeDecision classify(@Nullable String text) {
        if (text == null || text.isBlank()) {
            throw new DetectionFailureException("No text to scan");
        }
        if (text.length() > maxInputLength) {
            throw new DetectionFailureException("Text exceeds scan limit of " + maxInputLength + " characters");
        }
        List<DetectedSpan> spans = detector.detect(text);
        if (spans == null) {
            throw new DetectionFailureException("Detector returned no result");
        }
        return spans.isEmpty()
                ? SanitizeDecision.allowed(text)
                : SanitizeDecision.blocked(BlockReason.PHI_DETECTED, spans);
    }

    private AuditRequest toAuditRequest(SanitizeDecision decision, @Nullable String text, Actor actor, String requestId) {
        Map<String, Object> details = new HashMap<>();
        details.put("decision", decision.decision().name());
        details.put("text_length", text == null ? 0 : text.length());
        if (decision.reason() != null) {
            details.put("reason", decision.reason().name());
        }
        details.put("spans", decision.spans().stream()
                .map(span -> Map.of(
                        "category", span.category().name(),
                        "start", span.start(),
                        "end", span.end()))
                .toList());

        return decision.isAllowed()
                ? AuditRequest.success(actor, EVENT_TYPE, AuditAction.SANITIZE, RESOURCE_TYPE, requestId, details)
                : AuditRequest.failure(actor, EVENT_TYPE, AuditAction.SANITIZE, RESOURCE_TYPE, requestId, details);
    }

    /**
     * A sanitize decision that has been written to the audit trail.
     */
    public record AuditedDecision(
            @NonNull SanitizeDecision decision,
            @NonNull String auditEntryId,
            @NonNull String requestId
    ) {
    }
}
