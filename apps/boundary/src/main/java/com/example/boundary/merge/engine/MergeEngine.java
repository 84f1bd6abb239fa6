package com.example.boundary.merge.engine;

import com.example.boundary.audit.exception.AuditWriteException;
import com.example.boundary.audit.model.AuditAction;
import com.example.boundary.audit.model.AuditRequest;
import com.example.boundary.audit.service.AuditRecorder;
import com.example.boundary.common.util.StringSanitizer;
import com.example.boundary.context.exception.ContextNotFoundException;
import com.example.boundary.context.exception.TransientStorageException;
import com.example.boundary.context.model.ClientContext;
import com.example.boundary.context.model.CoupleLink;
import com.example.boundary.context.store.ContextLoader;
import com.example.boundary.identity.exception.AuthorizationException;
import com.example.boundary.identity.model.Actor;
import com.example.boundary.isolation.exception.PolicyViolationException;
import com.example.boundary.isolation.gate.IsolationGate;
import com.example.boundary.isolation.model.AbstractedView;
import com.example.boundary.isolation.model.WhitelistPolicy;
import com.example.boundary.isolation.policy.WhitelistPolicyRegistry;
import com.example.boundary.merge.combine.FrameworkCombiner;
import com.example.boundary.merge.exception.LockTimeoutException;
import com.example.boundary.merge.lock.CoupleLockRegistry;
import com.example.boundary.merge.model.MergeResult;
import com.example.boundary.merge.model.MergeState;
import com.example.boundary.merge.model.MergedFrameworkView;
import com.example.boundary.observability.metrics.BoundaryMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Couples merge orchestration.
 *
 * <p>Invocations for one couple run one at a time behind {@link CoupleLockRegistry}. Each invocation
 * walks REQUESTED, AUTHORIZED, EXTRACTING_A, EXTRACTING_B, MERGING and ends COMPLETED, REJECTED or
 * FAILED. Both partners are projected through the couples policy only; the per-partner views do not
 * leave {@link #combine}. One audit entry is written per invocation, success or failure.
 *
 * <p>Authorization and not-found problems before AUTHORIZED end REJECTED. Gate failures, context
 * store exhaustion and lock timeouts end FAILED. An audit write failure ends FAILED and is
 * propagated.
 */
@Slf4j
@Service
public class MergeEngine {

    static final String EVENT_TYPE = "couples_merge";
    static final String RESOURCE_TYPE = "couple_link";

    private final CoupleLockRegistry lockRegistry;
    private final ContextLoader contextLoader;
    private final WhitelistPolicyRegistry policyRegistry;
    private final IsolationGate isolationGate;
    private final FrameworkCombiner combiner;
    private final AuditRecorder auditRecorder;
    private final BoundaryMetrics metrics;
    private final List<MergeStateListener> listeners;
    private final Clock clock;

    public MergeEngine(
            CoupleLockRegistry lockRegistry,
            ContextLoader contextLoader,
            WhitelistPolicyRegistry policyRegistry,
            IsolationGate isolationGate,
            FrameworkCombiner combiner,
            AuditRecorder auditRecorder,
            BoundaryMetrics metrics,
            List<MergeStateListener> listeners,
            Clock clock) {
        this.lockRegistry = lockRegistry;
        this.contextLoader = contextLoader;
        this.policyRegistry = policyRegistry;
        this.isolationGate = isolationGate;
        this.combiner = combiner;
        this.auditRecorder = auditRecorder;
        this.metrics = metrics;
        this.listeners = List.copyOf(listeners);
        this.clock = clock;
    }

    public Mono<MergeResult> merge(@NonNull String coupleId, @NonNull Actor actor) {
        return Mono.defer(() -> {
            MergeInvocation invocation = new MergeInvocation(coupleId, listeners);
            Map<String, Object> details = new HashMap<>();
            details.put("invocation_id", invocation.invocationId());
            long started = System.nanoTime();

            return lockRegistry.withLock(coupleId, () -> run(invocation, actor, details))
                    .onErrorResume(LockTimeoutException.class,
                            e -> fail(invocation, actor, details, "LOCK_TIMEOUT"))
                    .doOnNext(result -> metrics.recordMerge(
                            result.state().name(), Duration.ofNanos(System.nanoTime() - started)))
                    .doOnError(AuditWriteException.class, e -> metrics.recordMerge(
                            MergeState.FAILED.name(), Duration.ofNanos(System.nanoTime() - started)));
        });
    }

    private Mono<MergeResult> run(MergeInvocation invocation, Actor actor, Map<String, Object> details) {
        String coupleId = invocation.coupleId();

        return authorize(coupleId, actor)
                .flatMap(partners -> {
                    invocation.transitionTo(MergeState.AUTHORIZED);
                    details.put("source_context_versions", Map.of(
                            partners.a().clientId(), partners.a().version(),
                            partners.b().clientId(), partners.b().version()));
                    return Mono.fromCallable(() -> combine(invocation, partners))
                            .flatMap(view -> complete(invocation, actor, details, view))
                            .onErrorResume(PolicyViolationException.class, e -> {
                                details.put("offending_fields", e.getOffendingFields());
                                return fail(invocation, actor, details, e.getReasonCode());
                            });
                })
                .onErrorResume(AuthorizationException.class,
                        e -> reject(invocation, actor, details, e.getReasonCode()))
                .onErrorResume(ContextNotFoundException.class,
                        e -> reject(invocation, actor, details, notFoundReason(e)))
                .onErrorResume(TransientStorageException.class,
                        e -> fail(invocation, actor, details, "STORAGE_UNAVAILABLE"))
                .onErrorResume(e -> !(e instanceof AuditWriteException), e -> {
                    log.error("Merge {} for couple {} failed unexpectedly: {}", invocation.invocationId(),
                            StringSanitizer.forLog(coupleId), e.getClass().getSimpleName());
                    return fail(invocation, actor, details, "INTERNAL_ERROR");
                })
                .doOnError(AuditWriteException.class, e -> markFailed(invocation));
    }

    private Mono<Partners> authorize(String coupleId, Actor actor) {
        if (!actor.isTherapist()) {
            return Mono.error(new AuthorizationException("ROLE_NOT_PERMITTED", "Only therapists may merge"));
        }
        return contextLoader.loadCoupleLink(coupleId)
                .flatMap(link -> {
                    if (!link.isActive()) {
                        return Mono.error(new AuthorizationException("LINK_NOT_ACTIVE", "Couple link is not active"));
                    }
                    if (!link.therapistId().equals(actor.userId())) {
                        return Mono.error(new AuthorizationException("THERAPIST_MISMATCH",
                                "Couple belongs to another therapist"));
                    }
                    if (!actor.isAssignedTo(link.partnerAContextId()) || !actor.isAssignedTo(link.partnerBContextId())) {
                        return Mono.error(new AuthorizationException("PARTNER_NOT_ASSIGNED",
                                "Partner contexts not assigned to actor"));
                    }
                    return Mono.zip(
                                    contextLoader.loadContext(link.partnerAContextId(), null),
                                    contextLoader.loadContext(link.partnerBContextId(), null))
                            .onErrorMap(ContextNotFoundException.class,
                                    e -> new AuthorizationException("PARTNER_CONTEXT_UNRESOLVABLE",
                                            "Partner context could not be resolved"))
                            .flatMap(pair -> verifyOwnership(link, new Partners(pair.getT1(), pair.getT2())));
                });
    }

    private static Mono<Partners> verifyOwnership(CoupleLink link, Partners partners) {
        if (!link.therapistId().equals(partners.a().therapistId())
                || !link.therapistId().equals(partners.b().therapistId())) {
            return Mono.error(new AuthorizationException("PARTNER_THERAPIST_MISMATCH",
                    "Partner context belongs to another therapist"));
        }
        return Mono.just(partners);
    }

    private MergedFrameworkView combine(MergeInvocation invocation, Partners partners) {
        WhitelistPolicy couplesPolicy = policyRegistry.couplesPolicy();

        invocation.transitionTo(MergeState.EXTRACTING_A);
        AbstractedView viewA = isolationGate.project(partners.a(), couplesPolicy);

        invocation.transitionTo(MergeState.EXTRACTING_B);
        AbstractedView viewB = isolationGate.project(partners.b(), couplesPolicy);

        invocation.transitionTo(MergeState.MERGING);
        return combiner.combine(invocation.coupleId(), viewA, viewB, Instant.now(clock));
    }

    private Mono<MergeResult> complete(
            MergeInvocation invocation, Actor actor, Map<String, Object> details, MergedFrameworkView view) {
        details.put("categories", List.copyOf(view.categories().keySet()));
        return auditRecorder.append(AuditRequest.success(
                        actor, EVENT_TYPE, AuditAction.MERGE, RESOURCE_TYPE, invocation.coupleId(), details))
                .map(auditId -> {
                    invocation.transitionTo(MergeState.COMPLETED);
                    return MergeResult.completed(view, auditId);
                });
    }

    private Mono<MergeResult> reject(
            MergeInvocation invocation, Actor actor, Map<String, Object> details, String reasonCode) {
        details.put("reason", reasonCode);
        return auditFailure(invocation, actor, details)
                .map(auditId -> {
                    invocation.transitionTo(MergeState.REJECTED);
                    return MergeResult.rejected(invocation.coupleId(), reasonCode, auditId);
                });
    }

    private Mono<MergeResult> fail(
            MergeInvocation invocation, Actor actor, Map<String, Object> details, String reasonCode) {
        details.put("reason", reasonCode);
        details.put("failed_in", invocation.state().name());
        return auditFailure(invocation, actor, details)
                .map(auditId -> {
                    invocation.transitionTo(MergeState.FAILED);
                    return MergeResult.failed(invocation.coupleId(), reasonCode, auditId);
                });
    }

    private Mono<String> auditFailure(MergeInvocation invocation, Actor actor, Map<String, Object> details) {
        return auditRecorder.append(AuditRequest.failure(
                        actor, EVENT_TYPE, AuditAction.MERGE, RESOURCE_TYPE, invocation.coupleId(), details));
    }

    private static void markFailed(MergeInvocation invocation) {
        if (!invocation.state().isTerminal()) {
            invocation.transitionTo(MergeState.FAILED);
        }
    }

    private static String notFoundReason(ContextNotFoundException e) {
        return "couple_link".equals(e.getResourceType()) ? "COUPLE_NOT_FOUND" : "PARTNER_CONTEXT_UNRESOLVABLE";
    }

    private record Partners(ClientContext a, ClientContext b) {
    }
}
