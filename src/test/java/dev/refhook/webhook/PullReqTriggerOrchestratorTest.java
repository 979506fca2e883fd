package dev.refhook.webhook;

import dev.refhook.domain.entity.Principal;
import dev.refhook.domain.entity.PullReq;
import dev.refhook.domain.entity.Repository;
import dev.refhook.domain.enums.WebhookTrigger;
import dev.refhook.exception.DiscardEventException;
import dev.refhook.exception.TriggerBackendException;
import dev.refhook.exception.TriggerCancelledException;
import dev.refhook.store.PrincipalStore;
import dev.refhook.store.PullReqStore;
import dev.refhook.store.RepositoryStore;
import dev.refhook.webhook.payload.BaseSegment;
import dev.refhook.webhook.payload.PrincipalInfo;
import dev.refhook.webhook.payload.PullReqCreatedPayload;
import dev.refhook.webhook.payload.PullReqInfo;
import dev.refhook.webhook.payload.PullReqSegment;
import dev.refhook.webhook.payload.ReferenceDetailsSegment;
import dev.refhook.webhook.payload.ReferenceInfo;
import dev.refhook.webhook.payload.ReferenceSegment;
import dev.refhook.webhook.payload.RepositoryInfo;
import dev.refhook.webhook.payload.TargetReferenceSegment;
import dev.refhook.webhook.payload.WebhookPayload;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static dev.refhook.webhook.TriggerFixtures.PRINCIPAL_ID;
import static dev.refhook.webhook.TriggerFixtures.PULLREQ_ID;
import static dev.refhook.webhook.TriggerFixtures.SOURCE_REPO_ID;
import static dev.refhook.webhook.TriggerFixtures.TARGET_REPO_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PullReqTriggerOrchestratorTest {

    private static final String EVENT_ID = "evt-1";
    private static final WebhookTrigger TRIGGER = WebhookTrigger.PULLREQ_CREATED;

    private PrincipalStore principalStore;
    private PullReqStore pullReqStore;
    private RepositoryStore repositoryStore;
    private RecordingWebhookDispatcher dispatcher;
    private SimpleMeterRegistry meterRegistry;
    private PullReqTriggerOrchestrator orchestrator;
    private AtomicInteger builderCalls;

    @BeforeEach
    void setUp() {
        principalStore = mock(PrincipalStore.class);
        pullReqStore = mock(PullReqStore.class);
        repositoryStore = mock(RepositoryStore.class);
        dispatcher = new RecordingWebhookDispatcher();
        meterRegistry = new SimpleMeterRegistry();
        orchestrator = new PullReqTriggerOrchestrator(principalStore, pullReqStore, repositoryStore,
                dispatcher, meterRegistry);
        builderCalls = new AtomicInteger();

        when(principalStore.findById(PRINCIPAL_ID)).thenReturn(Optional.of(TriggerFixtures.principal()));
        when(pullReqStore.findById(PULLREQ_ID)).thenReturn(Optional.of(TriggerFixtures.pullReq()));
        when(repositoryStore.findById(TARGET_REPO_ID)).thenReturn(Optional.of(TriggerFixtures.targetRepo()));
        when(repositoryStore.findById(SOURCE_REPO_ID)).thenReturn(Optional.of(TriggerFixtures.sourceRepo()));
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private void run(PayloadBuilder builder) {
        orchestrator.trigger(TRIGGER, EVENT_ID, PRINCIPAL_ID, PULLREQ_ID, builder);
    }

    private WebhookPayload simplePayload(Principal principal, PullReq pr, Repository targetRepo, Repository sourceRepo) {
        builderCalls.incrementAndGet();
        RepositoryInfo target = RepositoryInfo.from(targetRepo, path -> "https://git.example.com/" + path);
        RepositoryInfo source = RepositoryInfo.from(sourceRepo, path -> "https://git.example.com/" + path);
        return new PullReqCreatedPayload(
                new BaseSegment(TRIGGER, target, PrincipalInfo.from(principal)),
                new PullReqSegment(PullReqInfo.from(pr)),
                new TargetReferenceSegment(ReferenceInfo.branch(pr.targetBranch(), target)),
                new ReferenceSegment(ReferenceInfo.branch(pr.sourceBranch(), source)),
                new ReferenceDetailsSegment("abc123", null));
    }

    private double outcomeCount(String outcome) {
        return meterRegistry.counter(PullReqTriggerOrchestrator.OUTCOME_METRIC,
                "trigger", TRIGGER.value(), "outcome", outcome).count();
    }

    @Nested
    @DisplayName("successful trigger")
    class Success {

        @Test
        @DisplayName("should look up principal, pull request, target repo, source repo in that order")
        void shouldLookUpSequentially() {
            run(PullReqTriggerOrchestratorTest.this::simplePayload);

            InOrder order = inOrder(principalStore, pullReqStore, repositoryStore);
            order.verify(principalStore).findById(PRINCIPAL_ID);
            order.verify(pullReqStore).findById(PULLREQ_ID);
            order.verify(repositoryStore).findById(TARGET_REPO_ID);
            order.verify(repositoryStore).findById(SOURCE_REPO_ID);
        }

        @Test
        @DisplayName("should hand off exactly once, scoped to the target repository")
        void shouldDispatchOnceForTargetRepo() {
            run(PullReqTriggerOrchestratorTest.this::simplePayload);

            TriggerRequest request = dispatcher.single();
            assertThat(request.eventId()).isEqualTo(EVENT_ID);
            assertThat(request.trigger()).isEqualTo(TRIGGER);
            assertThat(request.targetRepo().id()).isEqualTo(TARGET_REPO_ID);
            assertThat(request.payload()).isInstanceOf(PullReqCreatedPayload.class);
            assertThat(builderCalls).hasValue(1);
        }

        @Test
        @DisplayName("should pass the loaded entities to the builder")
        void shouldPassEntitiesToBuilder() {
            run((principal, pr, targetRepo, sourceRepo) -> {
                assertThat(principal).isEqualTo(TriggerFixtures.principal());
                assertThat(pr).isEqualTo(TriggerFixtures.pullReq());
                assertThat(targetRepo).isEqualTo(TriggerFixtures.targetRepo());
                assertThat(sourceRepo).isEqualTo(TriggerFixtures.sourceRepo());
                return simplePayload(principal, pr, targetRepo, sourceRepo);
            });

            assertThat(dispatcher.requests()).hasSize(1);
        }

        @Test
        @DisplayName("should re-run the whole sequence when the same event is redelivered")
        void shouldReRunOnRedelivery() {
            run(PullReqTriggerOrchestratorTest.this::simplePayload);
            run(PullReqTriggerOrchestratorTest.this::simplePayload);

            assertThat(dispatcher.requests()).hasSize(2);
            assertThat(dispatcher.requests().get(0)).isEqualTo(dispatcher.requests().get(1));
            verify(principalStore, times(2)).findById(PRINCIPAL_ID);
            assertThat(outcomeCount("dispatched")).isEqualTo(2.0);
        }

        @Test
        @DisplayName("should record duration per trigger")
        void shouldRecordDuration() {
            run(PullReqTriggerOrchestratorTest.this::simplePayload);

            assertThat(meterRegistry.get(PullReqTriggerOrchestrator.DURATION_METRIC)
                    .tag("trigger", TRIGGER.value()).timer().count()).isEqualTo(1L);
        }
    }

    @Nested
    @DisplayName("missing entities")
    class NotFound {

        @Test
        @DisplayName("should discard when principal does not exist and never build or dispatch")
        void shouldDiscardMissingPrincipal() {
            when(principalStore.findById(PRINCIPAL_ID)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> run(PullReqTriggerOrchestratorTest.this::simplePayload))
                    .isInstanceOf(DiscardEventException.class)
                    .hasMessage("principal with id '7' doesn't exist");

            verify(pullReqStore, never()).findById(PULLREQ_ID);
            assertThat(builderCalls).hasValue(0);
            assertThat(dispatcher.requests()).isEmpty();
            assertThat(outcomeCount("discarded")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should discard when pull request does not exist")
        void shouldDiscardMissingPullReq() {
            when(pullReqStore.findById(PULLREQ_ID)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> run(PullReqTriggerOrchestratorTest.this::simplePayload))
                    .isInstanceOf(DiscardEventException.class)
                    .hasMessage("pull request with id '42' doesn't exist");

            assertThat(dispatcher.requests()).isEmpty();
        }

        @Test
        @DisplayName("should discard when only the source repository is missing")
        void shouldDiscardMissingSourceRepo() {
            when(repositoryStore.findById(SOURCE_REPO_ID)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> run(PullReqTriggerOrchestratorTest.this::simplePayload))
                    .isInstanceOf(DiscardEventException.class)
                    .hasMessage("repository with id '2' doesn't exist");

            verify(repositoryStore).findById(TARGET_REPO_ID);
            assertThat(builderCalls).hasValue(0);
            assertThat(dispatcher.requests()).isEmpty();
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("should wrap store failures as backend errors")
        void shouldWrapStoreFailure() {
            IllegalStateException cause = new IllegalStateException("connection reset");
            when(repositoryStore.findById(TARGET_REPO_ID)).thenThrow(cause);

            assertThatThrownBy(() -> run(PullReqTriggerOrchestratorTest.this::simplePayload))
                    .isInstanceOf(TriggerBackendException.class)
                    .hasMessage("failed to get repository with id '1'")
                    .hasCause(cause);

            assertThat(dispatcher.requests()).isEmpty();
            assertThat(outcomeCount("failed")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should abort with the builder's error and never dispatch")
        void shouldPropagateBuilderError() {
            assertThatThrownBy(() -> run((principal, pr, targetRepo, sourceRepo) -> {
                throw DiscardEventException.of("commit with sha '%s' doesn't exist", "abc123");
            }))
                    .isInstanceOf(DiscardEventException.class)
                    .hasMessage("commit with sha 'abc123' doesn't exist");

            assertThat(dispatcher.requests()).isEmpty();
        }

        @Test
        @DisplayName("should surface a failed handoff as a backend error")
        void shouldWrapDispatchFailure() {
            WebhookDispatcher failing = request -> { throw new IllegalStateException("queue unavailable"); };
            PullReqTriggerOrchestrator failingOrchestrator = new PullReqTriggerOrchestrator(
                    principalStore, pullReqStore, repositoryStore, failing, meterRegistry);

            assertThatThrownBy(() -> failingOrchestrator.trigger(TRIGGER, EVENT_ID, PRINCIPAL_ID, PULLREQ_ID,
                    PullReqTriggerOrchestratorTest.this::simplePayload))
                    .isInstanceOf(TriggerBackendException.class)
                    .hasMessageContaining("pullreq_created")
                    .hasMessageContaining(EVENT_ID);
        }
    }

    @Nested
    @DisplayName("cancellation")
    class Cancellation {

        @Test
        @DisplayName("should abort with a cancellation error when interrupted mid-lookup")
        void shouldCancelMidLookup() {
            when(pullReqStore.findById(PULLREQ_ID)).thenAnswer(invocation -> {
                Thread.currentThread().interrupt();
                return Optional.of(TriggerFixtures.pullReq());
            });

            assertThatThrownBy(() -> run(PullReqTriggerOrchestratorTest.this::simplePayload))
                    .isInstanceOf(TriggerCancelledException.class)
                    .isNotInstanceOf(DiscardEventException.class);

            verify(repositoryStore, never()).findById(TARGET_REPO_ID);
            assertThat(builderCalls).hasValue(0);
            assertThat(dispatcher.requests()).isEmpty();
            assertThat(outcomeCount("cancelled")).isEqualTo(1.0);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        }

        @Test
        @DisplayName("should not start lookups when already cancelled")
        void shouldNotStartWhenCancelled() {
            Thread.currentThread().interrupt();

            assertThatThrownBy(() -> run(PullReqTriggerOrchestratorTest.this::simplePayload))
                    .isInstanceOf(TriggerCancelledException.class);

            verify(principalStore, never()).findById(PRINCIPAL_ID);
            assertThat(dispatcher.requests()).isEmpty();
        }

        @Test
        @DisplayName("should treat a store reporting cancellation as cancelled, not as a backend failure")
        void shouldMapStoreCancellation() {
            when(repositoryStore.findById(SOURCE_REPO_ID)).thenThrow(new CancellationException("context cancelled"));

            assertThatThrownBy(() -> run(PullReqTriggerOrchestratorTest.this::simplePayload))
                    .isInstanceOf(TriggerCancelledException.class)
                    .hasCauseInstanceOf(CancellationException.class);

            assertThat(dispatcher.requests()).isEmpty();
        }
    }
}
