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
import dev.refhook.webhook.payload.WebhookPayload;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.function.LongFunction;

/**
 * Shared trigger routine for every pull-request event.
 *
 * <p>The flow:
 * <pre>
 *  1. Load principal
 *  2. Load pull request
 *  3. Load target repository, then source repository (they differ for forks)
 *  4. Invoke the handler's payload builder
 *  5. Hand the payload to delivery, scoped to the target repository
 * </pre>
 *
 * <p>Lookups run sequentially against independent stores, so the entities are not an
 * atomic snapshot; a pull request updated between two reads is accepted. Any failure
 * short-circuits the flow and nothing is handed to delivery. Nothing is retried here:
 * redelivery belongs to the event bus, and a redelivered event re-runs all five steps.
 *
 * <p>Cancellation is the thread's interrupt flag. It is checked before and after every
 * lookup and before the handoff.
 */
@Component
public class PullReqTriggerOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PullReqTriggerOrchestrator.class);

    static final String DURATION_METRIC = "refhook.trigger.duration";
    static final String OUTCOME_METRIC = "refhook.trigger.outcome";

    private final PrincipalStore principalStore;
    private final PullReqStore pullReqStore;
    private final RepositoryStore repositoryStore;
    private final WebhookDispatcher dispatcher;
    private final MeterRegistry meterRegistry;

    public PullReqTriggerOrchestrator(PrincipalStore principalStore,
                                      PullReqStore pullReqStore,
                                      RepositoryStore repositoryStore,
                                      WebhookDispatcher dispatcher,
                                      MeterRegistry meterRegistry) {
        this.principalStore = principalStore;
        this.pullReqStore = pullReqStore;
        this.repositoryStore = repositoryStore;
        this.dispatcher = dispatcher;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Runs one trigger attempt for {@code eventId}. Exactly one handoff on success.
     *
     * @throws DiscardEventException    an entity or commit the event refers to does not exist
     * @throws TriggerBackendException  a store, git or delivery call failed
     * @throws TriggerCancelledException the calling thread was interrupted
     */
    public void trigger(WebhookTrigger trigger, String eventId, long principalId, long pullReqId,
                        PayloadBuilder payloadBuilder) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "failed";
        try {
            Principal principal = lookup("principal", principalId, principalStore::findById);
            PullReq pullReq = lookup("pull request", pullReqId, pullReqStore::findById);
            Repository targetRepo = lookup("repository", pullReq.targetRepoId(), repositoryStore::findById);
            Repository sourceRepo = lookup("repository", pullReq.sourceRepoId(), repositoryStore::findById);

            WebhookPayload payload = payloadBuilder.build(principal, pullReq, targetRepo, sourceRepo);

            checkCancelled("delivery handoff");
            try {
                dispatcher.dispatch(new TriggerRequest(eventId, trigger, targetRepo, payload));
            } catch (RuntimeException e) {
                if (TriggerCancelledException.isCancellation(e)) {
                    throw TriggerCancelledException.wrap("delivery handoff cancelled", e);
                }
                throw new TriggerBackendException(
                        "failed to hand off %s for event '%s'".formatted(trigger.value(), eventId), e);
            }

            outcome = "dispatched";
            log.info("Triggered {} for event {} on repo {} (pull request #{})",
                    trigger.value(), eventId, targetRepo.id(), pullReq.number());
        } catch (DiscardEventException e) {
            outcome = "discarded";
            throw e;
        } catch (TriggerCancelledException e) {
            outcome = "cancelled";
            throw e;
        } finally {
            sample.stop(Timer.builder(DURATION_METRIC)
                    .description("Time from event intake to delivery handoff")
                    .tag("trigger", trigger.value())
                    .register(meterRegistry));
            meterRegistry.counter(OUTCOME_METRIC, "trigger", trigger.value(), "outcome", outcome).increment();
        }
    }

    private <T> T lookup(String kind, long id, LongFunction<Optional<T>> finder) {
        checkCancelled(kind + " lookup");
        Optional<T> found;
        try {
            found = finder.apply(id);
        } catch (RuntimeException e) {
            if (TriggerCancelledException.isCancellation(e)) {
                throw TriggerCancelledException.wrap("%s lookup cancelled".formatted(kind), e);
            }
            throw new TriggerBackendException("failed to get %s with id '%d'".formatted(kind, id), e);
        }
        checkCancelled(kind + " lookup");
        return found.orElseThrow(() -> DiscardEventException.of("%s with id '%d' doesn't exist", kind, id));
    }

    private static void checkCancelled(String stage) {
        if (Thread.currentThread().isInterrupted()) {
            throw new TriggerCancelledException("trigger cancelled at " + stage);
        }
    }
}
