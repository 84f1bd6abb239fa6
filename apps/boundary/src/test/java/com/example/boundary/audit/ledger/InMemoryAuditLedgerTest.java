package com.example.boundary.audit.ledger;

import com.example.boundary.audit.model.AuditAction;
import com.example.boundary.audit.model.AuditEntry;
import com.example.boundary.audit.model.AuditRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.Map;

import static com.example.boundary.util.ActorTestBuilder.aTherapist;
import static org.assertj.core.api.Assertions.assertThat;

class InMemoryAuditLedgerTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private InMemoryAuditLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryAuditLedger();
    }

    private static AuditEntry entry(String id, String userId, String resourceId, Instant timestamp) {
        AuditRequest request = AuditRequest.success(aTherapist(userId), "context_extract",
                AuditAction.EXTRACT, "client_context", resourceId, Map.of());
        return AuditEntry.from(request, id, timestamp);
    }

    @Test
    void shouldIgnoreRepeatedId() {
        AuditEntry original = entry("a-1", "therapist-1", "client-a", T0);
        AuditEntry replay = entry("a-1", "therapist-2", "client-b", T0.plusSeconds(1));

        StepVerifier.create(ledger.append(original)).expectNext(true).verifyComplete();
        StepVerifier.create(ledger.append(replay)).expectNext(false).verifyComplete();

        assertThat(ledger.snapshot()).containsExactly(original);
    }

    @Test
    void shouldQueryByResourceAndUserInTimeOrder() {
        ledger.append(entry("a-2", "therapist-1", "client-a", T0.plusSeconds(2))).block();
        ledger.append(entry("a-1", "therapist-1", "client-a", T0)).block();
        ledger.append(entry("a-3", "therapist-2", "client-b", T0.plusSeconds(1))).block();

        StepVerifier.create(ledger.findByResourceId("client-a").map(AuditEntry::id))
                .expectNext("a-1", "a-2")
                .verifyComplete();
        StepVerifier.create(ledger.findByUserId("therapist-2").map(AuditEntry::id))
                .expectNext("a-3")
                .verifyComplete();
    }

    @Test
    void shouldTreatRangeAsHalfOpen() {
        ledger.append(entry("a-1", "therapist-1", "client-a", T0)).block();
        ledger.append(entry("a-2", "therapist-1", "client-a", T0.plusSeconds(1))).block();

        StepVerifier.create(ledger.findBetween(T0, T0.plusSeconds(1)).map(AuditEntry::id))
                .expectNext("a-1")
                .verifyComplete();
    }
}
