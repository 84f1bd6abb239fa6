package com.example.boundary.isolation.service;

import com.example.boundary.audit.exception.AuditWriteException;
import com.example.boundary.audit.model.AuditAction;
import com.example.boundary.audit.model.AuditRequest;
import com.example.boundary.audit.service.AuditRecorder;
import com.example.boundary.common.util.StringSanitizer;
import com.example.boundary.context.exception.ContextNotFoundException;
import com.example.boundary.context.exception.TransientStorageException;
import com.example.boundary.context.model.ClientContext;
import com.example.boundary.context.store.ContextLoader;
import com.example.boundary.identity.exception.AuthorizationException;
import com.example.boundary.identity.model.Actor;
import com.example.boundary.isolation.exception.PolicyViolationException;
import com.example.boundary.isolation.gate.IsolationGate;
import com.example.boundary.isolation.model.AbstractedView;
import com.example.boundary.isolation.model.ExtractionRequest;
import com.example.boundary.isolation.model.ExtractionResult;
import com.example.boundary.isolation.model.WhitelistPolicy;
import com.example.boundary.isolation.policy.WhitelistPolicyRegistry;
import com.example.boundary.observability.metrics.BoundaryMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Single-client extraction: authorize, load, project through the named policy, audit.
 * Exactly one audit entry is written per call, before the result is emitted.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExtractionService {

    static final String EVENT_TYPE = "context_extraction";
    static final String RESOURCE_TYPE = "client_context";

    private final WhitelistPolicyRegistry policyRegistry;
    private final ContextLoader contextLoader;
    private final IsolationGate isolationGate;
    private final AuditRecorder auditRecorder;
    private final BoundaryMetrics metrics;

    public Mono<ExtractionResult> extract(
            @NonNull String contextId,
            @NonNull ExtractionRequest request,
            @NonNull Actor actor) {

        Map<String, Object> details = new HashMap<>();
        details.put("policy_id", request.policyId());
        details.put("requested_fields", request.fields() == null ? List.of() : List.copyOf(request.fields()));

        return Mono.fromCallable(() -> policyRegistry.resolve(request.policyId()))
                .doOnNext(policy -> details.put("policy_version", policy.version()))
                .flatMap(policy -> authorizeAssignment(actor, contextId)
                        .then(contextLoader.loadContext(contextId, request.version()))
                        .map(context -> project(context, policy, request, actor, details)))
                .flatMap(view -> {
                    details.put("context_version", view.contextVersion());
                    details.put("fields", new ArrayList<>(view.fields().keySet()));
                    return auditRecorder.append(AuditRequest.success(
                                    actor, EVENT_TYPE, AuditAction.EXTRACT, RESOURCE_TYPE, contextId, details))
                            .map(auditId -> ExtractionResult.extracted(view, auditId));
                })
                .onErrorResume(PolicyViolationException.class, e -> {
                    details.put("reason", e.getReasonCode());
                    details.put("offending_fields", e.getOffendingFields());
                    return auditFailure(actor, contextId, details)
                            .map(auditId -> ExtractionResult.violation(
                                    e.getReasonCode(), e.getOffendingFields(), auditId));
                })
                .onErrorResume(AuthorizationException.class, e -> {
                    details.put("reason", e.getReasonCode());
                    return auditFailure(actor, contextId, details)
                            .map(auditId -> ExtractionResult.denied(e.getReasonCode(), auditId));
                })
                .onErrorResume(ContextNotFoundException.class, e -> {
                    details.put("reason", "CONTEXT_NOT_FOUND");
                    return auditFailure(actor, contextId, details).map(ExtractionResult::notFound);
                })
                .onErrorResume(TransientStorageException.class, e -> {
                    details.put("reason", "STORAGE_UNAVAILABLE");
                    return auditFailure(actor, contextId, details).then(Mono.error(e));
                })
                .onErrorResume(ExtractionService::isUnaudited, e -> {
                    log.error("Extraction for context {} failed unexpectedly: {}",
                            StringSanitizer.forLog(contextId), e.getClass().getSimpleName());
                    details.put("reason", "INTERNAL_ERROR");
                    return auditFailure(actor, contextId, details).then(Mono.error(e));
                })
                .doOnNext(result -> {
                    metrics.recordExtract(result.outcome().name(), request.policyId());
                    log.info("Extraction {} for context {} under policy {}",
                            result.outcome(), StringSanitizer.forLog(contextId),
                            StringSanitizer.forLog(request.policyId()));
                });
    }

    private Mono<Void> authorizeAssignment(Actor actor, String contextId) {
        if (!actor.isTherapist()) {
            return Mono.error(new AuthorizationException("ROLE_NOT_PERMITTED", "Only therapists may extract"));
        }
        if (!actor.isAssignedTo(contextId)) {
            return Mono.error(new AuthorizationException("CLIENT_NOT_ASSIGNED", "Context not assigned to actor"));
        }
        return Mono.empty();
    }

    private AbstractedView project(
            ClientContext context,
            WhitelistPolicy policy,
            ExtractionRequest request,
            Actor actor,
            Map<String, Object> details) {
        details.put("context_version", context.version());
        if (!context.therapistId().equals(actor.userId())) {
            throw new AuthorizationException("THERAPIST_MISMATCH", "Context belongs to another therapist");
        }
        return isolationGate.project(context, policy, request.fields());
    }

    // audit failures and exhausted storage retries are already final
    private static boolean isUnaudited(Throwable e) {
        return !(e instanceof AuditWriteException) && !(e instanceof TransientStorageException);
    }

    private Mono<String> auditFailure(Actor actor, String contextId, Map<String, Object> details) {
        return auditRecorder.append(AuditRequest.failure(
                actor, EVENT_TYPE, AuditAction.EXTRACT, RESOURCE_TYPE, contextId, details));
    }
}
