package dev.refhook.webhook.payload;

/**
 * Body of a webhook, one concrete type per trigger kind. Each type lists its segments
 * as components in a fixed order; Jackson unwraps them so the wire body is flat.
 * Instances are built once per trigger attempt and never mutated.
 */
public sealed interface WebhookPayload
        permits PullReqCreatedPayload, PullReqReopenedPayload, PullReqBranchUpdatedPayload,
                PullReqClosedPayload, PullReqMergedPayload {

    BaseSegment base();

    PullReqSegment pullRequest();
}
