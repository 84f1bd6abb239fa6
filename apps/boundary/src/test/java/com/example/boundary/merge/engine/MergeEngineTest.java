package com.example.boundary.merge.engine;

import com.example.boundary.audit.exception.AuditWriteException;
import com.example.boundary.audit.ledger.AuditLedger;
import com.example.boundary.audit.ledger.InMemoryAuditLedger;
import com.example.boundary.audit.model.AuditAction;
import com.example.boundary.audit.model.AuditEntry;
import com.example.boundary.audit.model.AuditResult;
import com.example.boundary.config.BoundaryProperties;
import com.example.boundary.config.properties.ContextStoreProperties;
import com.example.boundary.context.model.CoupleLink;
import com.example.boundary.context.model.CoupleLinkStatus;
import com.example.boundary.context.model.Sensitivity;
import com.example.boundary.context.store.ContextLoader;
import com.example.boundary.context.store.ContextStoreClient;
import com.example.boundary.context.store.InMemoryContextStore;
import com.example.boundary.identity.model.Actor;
import com.example.boundary.isolation.gate.IsolationGate;
import com.example.boundary.merge.combine.FrameworkCombiner;
import com.example.boundary.merge.lock.CoupleLockRegistry;
import com.example.boundary.merge.model.MergeResult;
import com.example.boundary.merge.model.MergeState;
import com.example.boundary.observability.metrics.BoundaryMetrics;
import com.example.boundary.util.ScriptedLedger;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.TransientDataAccessResourceException;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.example.boundary.util.ActorTestBuilder.aComplianceOfficer;
import static com.example.boundary.util.ActorTestBuilder.aTherapist;
import static com.example.boundary.util.AuditRecorderTestBuilder.anAuditRecorder;
import static com.example.boundary.util.AuditRecorderTestBuilder.fastProperties;
import static com.example.boundary.util.ClientContextTestBuilder.aClinicalContext;
import static com.example.boundary.util.WhitelistPolicyTestBuilder.standardRegistry;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("MergeEngine")
class MergeEngineTest {

    private static final String COUPLE_ID = "couple-1";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final ContextStoreProperties STORE_PROPERTIES = new ContextStoreProperties(
            "in-memory", null, Duration.ofSeconds(1),
            new ContextStoreProperties.RetryProperties(3, Duration.ofMillis(5), Duration.ofMillis(20)));
    private static final CoupleLink LINK =
            new CoupleLink(COUPLE_ID, "client-a", "client-b", "therapist-1", CoupleLinkStatus.ACTIVE);

    @Mock
    private ContextStoreClient mockStore;

    @Mock
    private AuditLedger brokenLedger;

    private InMemoryContextStore store;
    private InMemoryAuditLedger ledger;
    private CoupleLockRegistry lockRegistry;
    private List<Transition> transitions;
    private Actor therapist;

    @BeforeEach
    void setUp() {
        store = new InMemoryContextStore();
        ledger = new InMemoryAuditLedger();
        lockRegistry = new CoupleLockRegistry(fastProperties());
        transitions = Collections.synchronizedList(new ArrayList<>());
        therapist = aTherapist("therapist-1", "client-a", "client-b");

        store.putCoupleLink(LINK);
        store.putContext(aClinicalContext("client-a", "therapist-1").withVersion(3).build());
        store.putContext(aClinicalContext("client-b", "therapist-1")
                .withVersion(5)
                .withField("attachment_patterns", Sensitivity.PHI_DERIVED, "avoidant attachment")
                .build());
    }

    private MergeEngine newEngine(ContextStoreClient client, AuditLedger auditLedger, MergeStateListener... extra) {
        List<MergeStateListener> listeners = new ArrayList<>(List.of(extra));
        listeners.add((invocation, from, to) -> transitions.add(new Transition(invocation.invocationId(), to)));
        return new MergeEngine(
                lockRegistry,
                new ContextLoader(client, STORE_PROPERTIES),
                standardRegistry(),
                new IsolationGate(),
                new FrameworkCombiner(new BoundaryProperties()),
                anAuditRecorder().withLedger(auditLedger).build(),
                new BoundaryMetrics(new SimpleMeterRegistry()),
                listeners,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private MergeEngine engine() {
        return newEngine(store, ledger);
    }

    private List<MergeState> states() {
        return transitions.stream().map(Transition::to).toList();
    }

    @Nested
    @DisplayName("Completed merges")
    class Completed {

        @Test
        @DisplayName("should merge framework categories and audit once")
        void shouldMergeAndAuditOnce() {
            StepVerifier.create(engine().merge(COUPLE_ID, therapist))
                    .assertNext(result -> {
                        assertThat(result.state()).isEqualTo(MergeState.COMPLETED);
                        assertThat(result.view().categories()).doesNotContainKeys("notes", "diagnosis");
                        assertThat(result.view().terms("attachment_patterns"))
                                .containsExactly("anxious attachment", "avoidant attachment");
                        assertThat(result.view().toString()).doesNotContain("depression", "F32.1");
                        assertThat(result.view().createdAt()).isEqualTo(NOW);
                    })
                    .verifyComplete();

            assertThat(states()).containsExactly(MergeState.AUTHORIZED, MergeState.EXTRACTING_A,
                    MergeState.EXTRACTING_B, MergeState.MERGING, MergeState.COMPLETED);
            assertThat(ledger.snapshot()).singleElement().satisfies(entry -> {
                assertThat(entry.action()).isEqualTo(AuditAction.MERGE);
                assertThat(entry.result()).isEqualTo(AuditResult.SUCCESS);
                assertThat(entry.resourceId()).isEqualTo(COUPLE_ID);
                assertThat(entry.details()).containsKeys("invocation_id", "source_context_versions", "categories");
            });
            assertThat(lockRegistry.activeKeys()).isZero();
        }

        @Test
        @DisplayName("should complete when the audit ledger fails twice before accepting the entry")
        void shouldCompleteAfterTransientAuditFailures() {
            ScriptedLedger flakyLedger = ScriptedLedger.failingTransiently(ledger, 2);

            StepVerifier.create(newEngine(store, flakyLedger).merge(COUPLE_ID, therapist))
                    .assertNext(result -> {
                        assertThat(result.state()).isEqualTo(MergeState.COMPLETED);
                        assertThat(result.auditEntryId()).isEqualTo(ledger.snapshot().get(0).id());
                    })
                    .verifyComplete();

            assertThat(flakyLedger.attempts()).hasSize(3);
            assertThat(ledger.snapshot()).singleElement()
                    .extracting(AuditEntry::result)
                    .isEqualTo(AuditResult.SUCCESS);
            assertThat(states()).endsWith(MergeState.COMPLETED);
        }
    }

    @Nested
    @DisplayName("Rejected merges")
    class Rejected {

        @Test
        @DisplayName("should reject when a partner context belongs to another therapist")
        void shouldRejectPartnerTherapistMismatch() {
            store.putContext(aClinicalContext("client-b", "therapist-2").withVersion(6).build());

            StepVerifier.create(engine().merge(COUPLE_ID, therapist))
                    .assertNext(result -> {
                        assertThat(result.state()).isEqualTo(MergeState.REJECTED);
                        assertThat(result.reasonCode()).isEqualTo("PARTNER_THERAPIST_MISMATCH");
                        assertThat(result.view()).isNull();
                    })
                    .verifyComplete();

            assertThat(states()).containsExactly(MergeState.REJECTED);
            assertThat(ledger.snapshot()).singleElement().satisfies(entry -> {
                assertThat(entry.result()).isEqualTo(AuditResult.FAILURE);
                assertThat(entry.details()).containsEntry("reason", "PARTNER_THERAPIST_MISMATCH");
            });
        }

        @Test
        @DisplayName("should reject an unknown couple")
        void shouldRejectUnknownCouple() {
            StepVerifier.create(engine().merge("couple-unknown", therapist))
                    .assertNext(result -> assertThat(result.reasonCode()).isEqualTo("COUPLE_NOT_FOUND"))
                    .verifyComplete();
            assertThat(ledger.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("should reject a paused couple link")
        void shouldRejectInactiveLink() {
            store.putCoupleLink(new CoupleLink(COUPLE_ID, "client-a", "client-b", "therapist-1",
                    CoupleLinkStatus.PAUSED));

            StepVerifier.create(engine().merge(COUPLE_ID, therapist))
                    .assertNext(result -> assertThat(result.reasonCode()).isEqualTo("LINK_NOT_ACTIVE"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should reject actors who are not therapists")
        void shouldRejectNonTherapist() {
            StepVerifier.create(engine().merge(COUPLE_ID, aComplianceOfficer()))
                    .assertNext(result -> assertThat(result.reasonCode()).isEqualTo("ROLE_NOT_PERMITTED"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should reject when a partner is not assigned to the therapist")
        void shouldRejectUnassignedPartner() {
            StepVerifier.create(engine().merge(COUPLE_ID, aTherapist("therapist-1", "client-a")))
                    .assertNext(result -> assertThat(result.reasonCode()).isEqualTo("PARTNER_NOT_ASSIGNED"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should reject when a partner context is missing")
        void shouldRejectMissingPartnerContext() {
            store.putCoupleLink(new CoupleLink(COUPLE_ID, "client-a", "client-z", "therapist-1",
                    CoupleLinkStatus.ACTIVE));

            StepVerifier.create(engine().merge(COUPLE_ID, aTherapist("therapist-1", "client-a", "client-z")))
                    .assertNext(result -> assertThat(result.reasonCode()).isEqualTo("PARTNER_CONTEXT_UNRESOLVABLE"))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Failed merges")
    class Failed {

        @Test
        @DisplayName("should fail when a partner's category field is restricted")
        void shouldFailOnRestrictedField() {
            store.putContext(aClinicalContext("client-a", "therapist-1")
                    .withVersion(4)
                    .withField("themes", Sensitivity.PHI_SENSITIVE, "trust")
                    .build());

            StepVerifier.create(engine().merge(COUPLE_ID, therapist))
                    .assertNext(result -> {
                        assertThat(result.state()).isEqualTo(MergeState.FAILED);
                        assertThat(result.reasonCode()).isEqualTo("RESTRICTED_FIELD_OUT_OF_SCOPE");
                    })
                    .verifyComplete();

            assertThat(states()).containsExactly(MergeState.AUTHORIZED, MergeState.EXTRACTING_A, MergeState.FAILED);
            assertThat(ledger.snapshot()).singleElement().satisfies(entry -> {
                assertThat(entry.result()).isEqualTo(AuditResult.FAILURE);
                assertThat(entry.details())
                        .containsEntry("failed_in", "EXTRACTING_A")
                        .containsEntry("offending_fields", List.of("themes"));
            });
        }

        @Test
        @DisplayName("should fail when the context store stays unavailable")
        void shouldFailWhenStoreUnavailable() {
            when(mockStore.getCoupleLink(COUPLE_ID)).thenReturn(Mono.just(LINK));
            when(mockStore.getContext(anyString(), any()))
                    .thenReturn(Mono.error(new TransientDataAccessResourceException("store down")));

            StepVerifier.create(newEngine(mockStore, ledger).merge(COUPLE_ID, therapist))
                    .assertNext(result -> {
                        assertThat(result.state()).isEqualTo(MergeState.FAILED);
                        assertThat(result.reasonCode()).isEqualTo("STORAGE_UNAVAILABLE");
                    })
                    .verifyComplete();
            assertThat(ledger.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("should propagate an audit write failure and end FAILED")
        void shouldPropagateAuditFailure() {
            when(brokenLedger.append(any()))
                    .thenReturn(Mono.error(new TransientDataAccessResourceException("ledger down")));

            StepVerifier.create(newEngine(store, brokenLedger).merge(COUPLE_ID, therapist))
                    .expectError(AuditWriteException.class)
                    .verify(Duration.ofSeconds(5));

            assertThat(states()).last().isEqualTo(MergeState.FAILED);
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @DisplayName("should not interleave extractions of concurrent merges for one couple")
        void shouldSerializeMergesPerCouple() {
            MergeStateListener slowExtraction = (invocation, from, to) -> {
                if (to == MergeState.EXTRACTING_A) {
                    try {
                        Thread.sleep(50);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
            };
            MergeEngine engine = newEngine(store, ledger, slowExtraction);

            List<MergeResult> results = Flux.range(0, 4)
                    .flatMap(i -> engine.merge(COUPLE_ID, therapist).subscribeOn(Schedulers.parallel()))
                    .collectList()
                    .block(Duration.ofSeconds(10));

            assertThat(results).hasSize(4).allMatch(MergeResult::isCompleted);

            List<String> runs = new ArrayList<>();
            for (Transition transition : transitions) {
                if (runs.isEmpty() || !runs.get(runs.size() - 1).equals(transition.invocationId())) {
                    runs.add(transition.invocationId());
                }
            }
            assertThat(runs).hasSize(4).doesNotHaveDuplicates();
            assertThat(ledger.size()).isEqualTo(4);
        }

        @Test
        @DisplayName("should release the couple when a merge is cancelled")
        void shouldReleaseOnCancel() {
            when(mockStore.getCoupleLink(COUPLE_ID)).thenReturn(Mono.just(LINK));
            when(mockStore.getContext(eq("client-a"), any()))
                    .thenReturn(Mono.just(aClinicalContext("client-a", "therapist-1").build()));
            when(mockStore.getContext(eq("client-b"), any())).thenReturn(Mono.never());

            Disposable stalled = newEngine(mockStore, ledger).merge(COUPLE_ID, therapist).subscribe();
            stalled.dispose();

            StepVerifier.create(engine().merge(COUPLE_ID, therapist))
                    .assertNext(result -> assertThat(result.isCompleted()).isTrue())
                    .verifyComplete();
            assertThat(ledger.size()).isEqualTo(1);
            assertThat(lockRegistry.activeKeys()).isZero();
        }
    }

    private record Transition(String invocationId, MergeState to) {
    }
}
