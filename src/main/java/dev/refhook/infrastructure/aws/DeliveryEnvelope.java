package dev.refhook.infrastructure.aws;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.refhook.domain.enums.WebhookTrigger;
import dev.refhook.webhook.TriggerRequest;
import dev.refhook.webhook.payload.WebhookPayload;

/**
 * Message body on the delivery queue. Webhooks are registered per repository, so the
 * parent is always the target repository of the pull request.
 */
public record DeliveryEnvelope(
        @JsonProperty("event_id") String eventId,
        WebhookTrigger trigger,
        @JsonProperty("parent_type") String parentType,
        @JsonProperty("parent_id") long parentId,
        WebhookPayload payload
) {
    static final String PARENT_REPO = "repo";

    public static DeliveryEnvelope of(TriggerRequest request) {
        return new DeliveryEnvelope(request.eventId(), request.trigger(), PARENT_REPO,
                request.targetRepo().id(), request.payload());
    }
}
