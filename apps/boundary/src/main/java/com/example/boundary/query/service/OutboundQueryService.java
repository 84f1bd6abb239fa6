package com.example.boundary.query.service;

import com.example.boundary.classifier.gate.AnonymizationGate;
import com.example.boundary.classifier.model.SanitizeDecision;
import com.example.boundary.identity.model.Actor;
import com.example.boundary.query.client.AnalyticsServiceClient;
import com.example.boundary.query.model.QueryResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * The only path from this service to the external analytical service.
 * Text reaches the client only after the anonymization gate has allowed it and the decision is audited.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutboundQueryService {

    private final AnonymizationGate anonymizationGate;
    private final AnalyticsServiceClient analyticsClient;

    public Mono<QueryResult> sanitizeAndQuery(@Nullable String text, @NonNull Actor actor) {
        return anonymizationGate.sanitize(text, actor)
                .flatMap(audited -> {
                    SanitizeDecision decision = audited.decision();
                    if (!decision.isAllowed()) {
                        log.info("Outbound query {} blocked: {}", audited.requestId(), decision.reason());
                        return Mono.just(QueryResult.blocked(
                                decision.reason(), decision.categories(),
                                audited.requestId(), audited.auditEntryId()));
                    }
                    return analyticsClient.query(decision.text())
                            .map(response -> QueryResult.allowed(
                                    response, audited.requestId(), audited.auditEntryId()));
                });
    }
}
