package dev.refhook.webhook.payload;

import dev.refhook.domain.enums.WebhookTrigger;

/**
 * Present in every payload. {@code trigger} is what subscribers discriminate on;
 * {@code repo} is the repository the webhook is registered for.
 */
public record BaseSegment(WebhookTrigger trigger, RepositoryInfo repo, PrincipalInfo principal) {}
