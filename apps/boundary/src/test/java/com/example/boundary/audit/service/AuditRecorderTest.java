package com.example.boundary.audit.service;

import com.example.boundary.audit.exception.AuditWriteException;
import com.example.boundary.audit.exception.TransientLedgerException;
import com.example.boundary.audit.ledger.InMemoryAuditLedger;
import com.example.boundary.audit.model.AuditAction;
import com.example.boundary.audit.model.AuditEntry;
import com.example.boundary.audit.model.AuditRequest;
import com.example.boundary.util.ScriptedLedger;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static com.example.boundary.util.ActorTestBuilder.aTherapist;
import static com.example.boundary.util.AuditRecorderTestBuilder.anAuditRecorder;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AuditRecorder")
class AuditRecorderTest {

    private InMemoryAuditLedger store;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        store = new InMemoryAuditLedger();
        meterRegistry = new SimpleMeterRegistry();
    }

    private static AuditRequest extractRequest(String resourceId) {
        return AuditRequest.success(aTherapist("therapist-1", resourceId), "context_extract",
                AuditAction.EXTRACT, "client_context", resourceId, Map.of("policy_id", "therapist-framework"));
    }

    @Nested
    @DisplayName("Retries")
    class Retries {

        @Test
        @DisplayName("should store a single entry when the first attempts fail transiently")
        void shouldRetryTransientFailures() {
            // first attempt lands but loses its acknowledgement, second fails outright
            ScriptedLedger ledger = new ScriptedLedger(store, List.of(
                    entry -> store.append(entry).then(Mono.error(new TransientLedgerException("ack lost"))),
                    entry -> Mono.error(new TransientLedgerException("primary stepped down"))));
            AuditRecorder recorder = anAuditRecorder().withLedger(ledger).withMeterRegistry(meterRegistry).build();

            StepVerifier.create(recorder.append(extractRequest("client-a")))
                    .assertNext(id -> assertThat(store.snapshot())
                            .singleElement()
                            .extracting(AuditEntry::id)
                            .isEqualTo(id))
                    .verifyComplete();

            assertThat(ledger.attempts()).hasSize(3);
            assertThat(ledger.attempts()).extracting(AuditEntry::id).containsOnly(ledger.attempts().get(0).id());
            assertThat(meterRegistry.counter("boundary.audit.write.retry").count()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("should bound each attempt with the configured timeout")
        void shouldTimeOutHungAttempts() {
            ScriptedLedger ledger = new ScriptedLedger(store, List.of(entry -> Mono.never()));
            AuditRecorder recorder = anAuditRecorder()
                    .withLedger(ledger)
                    .withTimeout(Duration.ofMillis(50))
                    .build();

            StepVerifier.create(recorder.append(extractRequest("client-a")))
                    .expectNextCount(1)
                    .verifyComplete();

            assertThat(ledger.attempts()).hasSize(2);
            assertThat(store.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("should raise AuditWriteException when attempts are exhausted")
        void shouldFailWhenExhausted() {
            Function<AuditEntry, Mono<Boolean>> down = entry -> Mono.error(new TransientLedgerException("down"));
            ScriptedLedger ledger = new ScriptedLedger(store, List.of(down, down, down, down));
            AuditRecorder recorder = anAuditRecorder().withLedger(ledger).withMeterRegistry(meterRegistry).build();

            StepVerifier.create(recorder.append(extractRequest("client-a")))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(AuditWriteException.class);
                        assertThat(error.getCause()).isInstanceOf(TransientLedgerException.class);
                    })
                    .verify();

            assertThat(ledger.attempts()).hasSize(3);
            assertThat(store.size()).isZero();
            assertThat(meterRegistry.counter("boundary.audit.write", "outcome", "failure").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should not retry non-transient failures")
        void shouldNotRetryPermanentFailures() {
            ScriptedLedger ledger = new ScriptedLedger(store, List.of(
                    entry -> Mono.error(new IllegalStateException("schema rejected entry"))));
            AuditRecorder recorder = anAuditRecorder().withLedger(ledger).build();

            StepVerifier.create(recorder.append(extractRequest("client-a")))
                    .expectError(AuditWriteException.class)
                    .verify();

            assertThat(ledger.attempts()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Entries")
    class Entries {

        @Test
        @DisplayName("should assign strictly increasing timestamps when the clock stalls")
        void shouldAssignMonotonicTimestamps() {
            Clock stalled = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
            AuditRecorder recorder = anAuditRecorder().withLedger(store).withClock(stalled).build();

            Flux.concat(
                            recorder.append(extractRequest("client-a")),
                            recorder.append(extractRequest("client-b")),
                            recorder.append(extractRequest("client-c")))
                    .blockLast();

            List<Instant> timestamps = store.snapshot().stream().map(AuditEntry::timestamp).toList();
            assertThat(timestamps).hasSize(3).isSorted().doesNotHaveDuplicates();
            assertThat(timestamps.get(0)).isEqualTo(Instant.parse("2026-03-01T10:00:00Z"));
        }

        @Test
        @DisplayName("should copy actor identity into the entry")
        void shouldCopyActorIdentity() {
            AuditRecorder recorder = anAuditRecorder().withLedger(store).build();

            recorder.append(extractRequest("client-a")).block();

            assertThat(store.snapshot()).singleElement().satisfies(entry -> {
                assertThat(entry.userId()).isEqualTo("therapist-1");
                assertThat(entry.actorRole()).isEqualTo("THERAPIST");
                assertThat(entry.ipAddress()).isEqualTo("10.0.0.1");
                assertThat(entry.correlationId()).isEqualTo("corr-test");
                assertThat(entry.details()).containsEntry("policy_id", "therapist-framework");
            });
        }
    }

    @Nested
    @DisplayName("Queries")
    class Queries {

        @Test
        @DisplayName("should reject a range whose start is not before its end")
        void shouldRejectEmptyRange() {
            AuditRecorder recorder = anAuditRecorder().withLedger(store).build();
            Instant now = Instant.now();

            StepVerifier.create(recorder.findBetween(now, now))
                    .expectError(IllegalArgumentException.class)
                    .verify();
        }

        @Test
        @DisplayName("should find entries by resource and by actor")
        void shouldFindEntries() {
            AuditRecorder recorder = anAuditRecorder().withLedger(store).build();
            Flux.concat(recorder.append(extractRequest("client-a")), recorder.append(extractRequest("client-b")))
                    .blockLast();

            StepVerifier.create(recorder.findByResourceId("client-b"))
                    .assertNext(entry -> assertThat(entry.resourceId()).isEqualTo("client-b"))
                    .verifyComplete();
            StepVerifier.create(recorder.findByActor("therapist-1"))
                    .expectNextCount(2)
                    .verifyComplete();
        }
    }
}
