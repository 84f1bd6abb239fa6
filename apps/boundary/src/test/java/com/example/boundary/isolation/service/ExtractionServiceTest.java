package com.example.boundary.isolation.service;

import com.example.boundary.audit.ledger.AuditLedger;
import com.example.boundary.audit.ledger.InMemoryAuditLedger;
import com.example.boundary.audit.model.AuditAction;
import com.example.boundary.audit.model.AuditEntry;
import com.example.boundary.audit.model.AuditResult;
import com.example.boundary.config.properties.ContextStoreProperties;
import com.example.boundary.context.exception.TransientStorageException;
import com.example.boundary.context.model.Sensitivity;
import com.example.boundary.context.store.ContextLoader;
import com.example.boundary.context.store.ContextStoreClient;
import com.example.boundary.context.store.InMemoryContextStore;
import com.example.boundary.identity.model.Actor;
import com.example.boundary.identity.model.Role;
import com.example.boundary.isolation.gate.IsolationGate;
import com.example.boundary.isolation.model.ExtractionRequest;
import com.example.boundary.isolation.model.ExtractionResult;
import com.example.boundary.isolation.policy.WhitelistPolicyRegistry;
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
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static com.example.boundary.util.ActorTestBuilder.aComplianceOfficer;
import static com.example.boundary.util.ActorTestBuilder.aTherapist;
import static com.example.boundary.util.ActorTestBuilder.anActor;
import static com.example.boundary.util.AuditRecorderTestBuilder.anAuditRecorder;
import static com.example.boundary.util.ClientContextTestBuilder.aClinicalContext;
import static com.example.boundary.util.ClientContextTestBuilder.aContext;
import static com.example.boundary.util.WhitelistPolicyTestBuilder.standardRegistry;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ExtractionService")
class ExtractionServiceTest {

    private static final ContextStoreProperties STORE_PROPERTIES = new ContextStoreProperties(
            "in-memory", null, Duration.ofSeconds(1),
            new ContextStoreProperties.RetryProperties(3, Duration.ofMillis(5), Duration.ofMillis(20)));

    @Mock
    private ContextStoreClient failingStore;

    private InMemoryContextStore store;
    private InMemoryAuditLedger ledger;
    private ExtractionService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryContextStore();
        ledger = new InMemoryAuditLedger();
        service = newService(store, standardRegistry());
    }

    private ExtractionService newService(ContextStoreClient client, WhitelistPolicyRegistry registry) {
        return newService(client, registry, ledger);
    }

    private ExtractionService newService(
            ContextStoreClient client, WhitelistPolicyRegistry registry, AuditLedger auditLedger) {
        return new ExtractionService(
                registry,
                new ContextLoader(client, STORE_PROPERTIES),
                new IsolationGate(),
                anAuditRecorder().withLedger(auditLedger).build(),
                new BoundaryMetrics(new SimpleMeterRegistry()));
    }

    @Nested
    @DisplayName("Successful extraction")
    class Successful {

        @Test
        @DisplayName("should return the whitelisted view and audit one success")
        void shouldReturnWhitelistedView() {
            store.putContext(aContext()
                    .withClientId("client-a")
                    .withField("notes", Sensitivity.PHI_CRITICAL, "client reports depression")
                    .withField("themes", Sensitivity.PHI_DERIVED, "communication")
                    .build());

            StepVerifier.create(service.extract("client-a",
                            new ExtractionRequest("therapist-framework", null, List.of("themes")),
                            aTherapist("therapist-1", "client-a")))
                    .assertNext(result -> {
                        assertThat(result.outcome()).isEqualTo(ExtractionResult.Outcome.EXTRACTED);
                        assertThat(result.view().fields()).containsOnlyKeys("themes");
                        assertThat(result.view().values("themes")).containsExactly("communication");
                        assertThat(result.auditEntryId()).isNotBlank();
                    })
                    .verifyComplete();

            assertThat(ledger.snapshot()).singleElement().satisfies(entry -> {
                assertThat(entry.action()).isEqualTo(AuditAction.EXTRACT);
                assertThat(entry.result()).isEqualTo(AuditResult.SUCCESS);
                assertThat(entry.resourceId()).isEqualTo("client-a");
                assertThat(entry.details()).containsEntry("fields", List.of("themes"));
            });
        }

        @Test
        @DisplayName("should read the requested context version")
        void shouldReadRequestedVersion() {
            store.putContext(aClinicalContext("client-a", "therapist-1").withVersion(1).build());
            store.putContext(aClinicalContext("client-a", "therapist-1").withVersion(2).build());

            StepVerifier.create(service.extract("client-a",
                            new ExtractionRequest("therapist-framework", 1L, null),
                            aTherapist("therapist-1", "client-a")))
                    .assertNext(result -> assertThat(result.view().contextVersion()).isEqualTo(1))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should still extract when the audit ledger fails twice before accepting the entry")
        void shouldSucceedAfterTransientAuditFailures() {
            store.putContext(aClinicalContext("client-a", "therapist-1").build());
            ScriptedLedger flakyLedger = ScriptedLedger.failingTransiently(ledger, 2);
            service = newService(store, standardRegistry(), flakyLedger);

            StepVerifier.create(service.extract("client-a",
                            new ExtractionRequest("therapist-framework", null, List.of("themes")),
                            aTherapist("therapist-1", "client-a")))
                    .assertNext(result -> {
                        assertThat(result.outcome()).isEqualTo(ExtractionResult.Outcome.EXTRACTED);
                        assertThat(result.auditEntryId()).isEqualTo(ledger.snapshot().get(0).id());
                    })
                    .verifyComplete();

            assertThat(flakyLedger.attempts()).hasSize(3);
            assertThat(ledger.snapshot()).singleElement()
                    .extracting(AuditEntry::result)
                    .isEqualTo(AuditResult.SUCCESS);
        }
    }

    @Nested
    @DisplayName("Refused extraction")
    class Refused {

        @BeforeEach
        void seed() {
            store.putContext(aClinicalContext("client-a", "therapist-1").build());
        }

        @Test
        @DisplayName("should report a policy violation for an unlisted field and audit a failure")
        void shouldReportPolicyViolation() {
            StepVerifier.create(service.extract("client-a",
                            new ExtractionRequest("therapist-framework", null, List.of("themes", "notes")),
                            aTherapist("therapist-1", "client-a")))
                    .assertNext(result -> {
                        assertThat(result.outcome()).isEqualTo(ExtractionResult.Outcome.POLICY_VIOLATION);
                        assertThat(result.view()).isNull();
                        assertThat(result.offendingFields()).containsExactly("notes");
                    })
                    .verifyComplete();

            assertThat(ledger.snapshot()).singleElement()
                    .extracting(AuditEntry::result)
                    .isEqualTo(AuditResult.FAILURE);
        }

        @Test
        @DisplayName("should report a violation for an unknown policy")
        void shouldReportUnknownPolicy() {
            StepVerifier.create(service.extract("client-a",
                            new ExtractionRequest("nope", null, null),
                            aTherapist("therapist-1", "client-a")))
                    .assertNext(result -> assertThat(result.reasonCode()).isEqualTo("UNKNOWN_POLICY"))
                    .verifyComplete();
            assertThat(ledger.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("should deny a therapist not assigned to the client")
        void shouldDenyUnassignedTherapist() {
            StepVerifier.create(service.extract("client-a",
                            new ExtractionRequest("therapist-framework", null, null),
                            aTherapist("therapist-1", "client-b")))
                    .assertNext(result -> {
                        assertThat(result.outcome()).isEqualTo(ExtractionResult.Outcome.DENIED);
                        assertThat(result.reasonCode()).isEqualTo("CLIENT_NOT_ASSIGNED");
                    })
                    .verifyComplete();
            assertThat(ledger.snapshot()).singleElement()
                    .extracting(AuditEntry::result)
                    .isEqualTo(AuditResult.FAILURE);
        }

        @Test
        @DisplayName("should deny when the context belongs to another therapist")
        void shouldDenyOtherTherapistsContext() {
            StepVerifier.create(service.extract("client-a",
                            new ExtractionRequest("therapist-framework", null, null),
                            aTherapist("therapist-2", "client-a")))
                    .assertNext(result -> assertThat(result.reasonCode()).isEqualTo("THERAPIST_MISMATCH"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should deny compliance officers")
        void shouldDenyComplianceOfficer() {
            Actor officer = anActor().withRole(Role.COMPLIANCE_OFFICER).withAssignedClients("client-a").build();

            StepVerifier.create(service.extract("client-a",
                            new ExtractionRequest("therapist-framework", null, null), officer))
                    .assertNext(result -> assertThat(result.reasonCode()).isEqualTo("ROLE_NOT_PERMITTED"))
                    .verifyComplete();
            assertThat(aComplianceOfficer().isTherapist()).isFalse();
        }

        @Test
        @DisplayName("should report not found for an unknown context")
        void shouldReportNotFound() {
            StepVerifier.create(service.extract("client-x",
                            new ExtractionRequest("therapist-framework", null, null),
                            aTherapist("therapist-1", "client-x")))
                    .assertNext(result -> assertThat(result.outcome()).isEqualTo(ExtractionResult.Outcome.NOT_FOUND))
                    .verifyComplete();
            assertThat(ledger.size()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Storage failures")
    class StorageFailures {

        @Test
        @DisplayName("should audit a failure and surface exhaustion as TransientStorageException")
        void shouldSurfaceStorageExhaustion() {
            when(failingStore.getContext(eq("client-a"), any()))
                    .thenReturn(Mono.error(new TransientDataAccessResourceException("store down")));
            service = newService(failingStore, standardRegistry());

            StepVerifier.create(service.extract("client-a",
                            new ExtractionRequest("therapist-framework", null, null),
                            aTherapist("therapist-1", "client-a")))
                    .expectError(TransientStorageException.class)
                    .verify(Duration.ofSeconds(5));

            assertThat(ledger.snapshot()).singleElement().satisfies(entry -> {
                assertThat(entry.result()).isEqualTo(AuditResult.FAILURE);
                assertThat(entry.details()).containsEntry("reason", "STORAGE_UNAVAILABLE");
            });
        }

        @Test
        @DisplayName("should audit a failure and propagate a non-retryable store error")
        void shouldAuditNonRetryableStoreError() {
            when(failingStore.getContext(eq("client-a"), any()))
                    .thenReturn(Mono.error(WebClientResponseException.create(
                            HttpStatus.FORBIDDEN.value(), "Forbidden", HttpHeaders.EMPTY, new byte[0], null)));
            service = newService(failingStore, standardRegistry());

            StepVerifier.create(service.extract("client-a",
                            new ExtractionRequest("therapist-framework", null, null),
                            aTherapist("therapist-1", "client-a")))
                    .expectError(WebClientResponseException.Forbidden.class)
                    .verify(Duration.ofSeconds(5));

            assertThat(ledger.snapshot()).singleElement().satisfies(entry -> {
                assertThat(entry.result()).isEqualTo(AuditResult.FAILURE);
                assertThat(entry.resourceId()).isEqualTo("client-a");
                assertThat(entry.details()).containsEntry("reason", "INTERNAL_ERROR");
            });
        }

        @Test
        @DisplayName("should audit a failure when the store returns a malformed context")
        void shouldAuditMalformedContext() {
            when(failingStore.getContext(eq("client-a"), any()))
                    .thenReturn(Mono.error(new IllegalArgumentException("clientId must not be blank")));
            service = newService(failingStore, standardRegistry());

            StepVerifier.create(service.extract("client-a",
                            new ExtractionRequest("therapist-framework", null, null),
                            aTherapist("therapist-1", "client-a")))
                    .expectError(IllegalArgumentException.class)
                    .verify(Duration.ofSeconds(5));

            assertThat(ledger.size()).isEqualTo(1);
        }
    }
}
