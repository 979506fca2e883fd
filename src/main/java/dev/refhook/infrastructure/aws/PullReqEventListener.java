package dev.refhook.infrastructure.aws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.refhook.domain.enums.WebhookTrigger;
import dev.refhook.domain.event.Event;
import dev.refhook.domain.event.pullreq.BranchUpdatedPayload;
import dev.refhook.domain.event.pullreq.ClosedPayload;
import dev.refhook.domain.event.pullreq.CreatedPayload;
import dev.refhook.domain.event.pullreq.MergedPayload;
import dev.refhook.domain.event.pullreq.ReopenedPayload;
import dev.refhook.exception.DiscardEventException;
import dev.refhook.exception.TriggerCancelledException;
import dev.refhook.webhook.WebhookTriggerService;
import io.awspring.cloud.sqs.annotation.SqsListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.function.Consumer;

/**
 * SQS consumers for pull-request lifecycle events, one queue per event kind.
 *
 * <p>
 * Architecture flow:
 *
 * <pre>
 * pull-request service → [SQS queue per kind] → THIS → WebhookTriggerService → delivery queue
 * </pre>
 *
 * <p>
 * Delivery is at least once and unordered, also across queues. Each message is handled
 * from scratch, so a redelivered event simply runs its trigger again; deduplication by
 * event id happens downstream.
 *
 * <p>
 * Error handling:
 * <ul>
 * <li><b>Malformed message</b>: logged and acknowledged. It will never parse.</li>
 * <li><b>{@link DiscardEventException}</b>: an entity or commit is gone. Logged and
 * acknowledged, redelivery would hit the same gap.</li>
 * <li><b>Anything else</b>: propagated, so the message is not acknowledged and SQS
 * redelivers it after the visibility timeout (then DLQ after maxReceiveCount).
 * Cancellation takes the same path but is not logged as a failure.</li>
 * </ul>
 *
 * <p>
 * Shutdown: the listener container stops polling and drains in-flight invocations,
 * see {@link dev.refhook.config.SqsConfig}.
 */
@Component
public class PullReqEventListener {

    private static final Logger log = LoggerFactory.getLogger(PullReqEventListener.class);

    static final String MDC_EVENT_ID = "eventId";
    static final String MDC_TRIGGER = "trigger";

    private static final TypeReference<Event<CreatedPayload>> CREATED = new TypeReference<>() {};
    private static final TypeReference<Event<ReopenedPayload>> REOPENED = new TypeReference<>() {};
    private static final TypeReference<Event<BranchUpdatedPayload>> BRANCH_UPDATED = new TypeReference<>() {};
    private static final TypeReference<Event<ClosedPayload>> CLOSED = new TypeReference<>() {};
    private static final TypeReference<Event<MergedPayload>> MERGED = new TypeReference<>() {};

    private final WebhookTriggerService triggerService;
    private final ObjectMapper objectMapper;

    public PullReqEventListener(WebhookTriggerService triggerService, ObjectMapper objectMapper) {
        this.triggerService = triggerService;
        this.objectMapper = objectMapper;
    }

    @SqsListener("${refhook.events.queues.created:pullreq-created}")
    public void onCreated(String message) {
        consume(message, CREATED, WebhookTrigger.PULLREQ_CREATED, triggerService::handlePullReqCreated);
    }

    @SqsListener("${refhook.events.queues.reopened:pullreq-reopened}")
    public void onReopened(String message) {
        consume(message, REOPENED, WebhookTrigger.PULLREQ_REOPENED, triggerService::handlePullReqReopened);
    }

    @SqsListener("${refhook.events.queues.branch-updated:pullreq-branch-updated}")
    public void onBranchUpdated(String message) {
        consume(message, BRANCH_UPDATED, WebhookTrigger.PULLREQ_BRANCH_UPDATED,
                triggerService::handlePullReqBranchUpdated);
    }

    @SqsListener("${refhook.events.queues.closed:pullreq-closed}")
    public void onClosed(String message) {
        consume(message, CLOSED, WebhookTrigger.PULLREQ_CLOSED, triggerService::handlePullReqClosed);
    }

    @SqsListener("${refhook.events.queues.merged:pullreq-merged}")
    public void onMerged(String message) {
        consume(message, MERGED, WebhookTrigger.PULLREQ_MERGED, triggerService::handlePullReqMerged);
    }

    private <T> void consume(String message, TypeReference<Event<T>> type, WebhookTrigger trigger,
                             Consumer<Event<T>> handler) {
        Event<T> event;
        try {
            event = objectMapper.readValue(message, type);
        } catch (JsonProcessingException e) {
            log.error("Invalid {} event message, dropping: {}", trigger.value(), e.getOriginalMessage());
            return; // acknowledged, it will never parse
        }

        MDC.put(MDC_EVENT_ID, event.id());
        MDC.put(MDC_TRIGGER, trigger.value());
        try {
            handler.accept(event);
        } catch (DiscardEventException e) {
            log.warn("Discarding event {} for {}: {}", event.id(), trigger.value(), e.getMessage());
        } catch (TriggerCancelledException e) {
            log.debug("Event {} for {} cancelled: {}", event.id(), trigger.value(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Event {} for {} failed, leaving it for redelivery: {}",
                    event.id(), trigger.value(), e.getMessage(), e);
            throw e;
        } finally {
            MDC.remove(MDC_EVENT_ID);
            MDC.remove(MDC_TRIGGER);
        }
    }
}
