package dev.refhook.webhook;

import dev.refhook.domain.entity.Repository;
import dev.refhook.domain.enums.WebhookTrigger;
import dev.refhook.webhook.payload.WebhookPayload;

/**
 * Handoff to delivery. Subscriptions are matched on {@code trigger} and
 * {@code targetRepo}; {@code eventId} is the deduplication key for redelivered events.
 */
public record TriggerRequest(String eventId, WebhookTrigger trigger, Repository targetRepo, WebhookPayload payload) {
    public TriggerRequest {
        if (eventId == null) throw new IllegalArgumentException("eventId required");
        if (trigger == null) throw new IllegalArgumentException("trigger required");
        if (targetRepo == null) throw new IllegalArgumentException("targetRepo required");
        if (payload == null) throw new IllegalArgumentException("payload required");
    }
}
