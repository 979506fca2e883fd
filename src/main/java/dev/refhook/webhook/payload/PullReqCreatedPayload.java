package dev.refhook.webhook.payload;

import com.fasterxml.jackson.annotation.JsonUnwrapped;

/**
 * Body of the {@code pullreq_created} trigger.
 */
public record PullReqCreatedPayload(
        @JsonUnwrapped BaseSegment base,
        @JsonUnwrapped PullReqSegment pullRequest,
        @JsonUnwrapped TargetReferenceSegment targetReference,
        @JsonUnwrapped ReferenceSegment reference,
        @JsonUnwrapped ReferenceDetailsSegment referenceDetails
) implements WebhookPayload {}
