package dev.refhook.webhook;

import dev.refhook.domain.entity.Principal;
import dev.refhook.domain.entity.PullReq;
import dev.refhook.domain.entity.Repository;
import dev.refhook.webhook.payload.WebhookPayload;

/**
 * Builds the trigger-specific payload once all entities of the event are loaded.
 * Throwing aborts the trigger with that exception.
 */
@FunctionalInterface
public interface PayloadBuilder {
    WebhookPayload build(Principal principal, PullReq pullReq, Repository targetRepo, Repository sourceRepo);
}
