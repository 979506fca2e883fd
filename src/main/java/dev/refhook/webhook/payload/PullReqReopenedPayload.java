package dev.refhook.webhook.payload;

import com.fasterxml.jackson.annotation.JsonUnwrapped;

/**
 * Body of the {@code pullreq_reopened} trigger. Same segments as
 * {@link PullReqCreatedPayload}, kept as its own type so the two triggers stay
 * separate in the API contract.
 */
public record PullReqReopenedPayload(
        @JsonUnwrapped BaseSegment base,
        @JsonUnwrapped PullReqSegment pullRequest,
        @JsonUnwrapped TargetReferenceSegment targetReference,
        @JsonUnwrapped ReferenceSegment reference,
        @JsonUnwrapped ReferenceDetailsSegment referenceDetails
) implements WebhookPayload {}
