package dev.refhook.webhook.payload;

import com.fasterxml.jackson.annotation.JsonUnwrapped;

/**
 * Body of the {@code pullreq_closed} trigger. {@code referenceDetails} holds the source
 * branch head at the time of closing.
 */
public record PullReqClosedPayload(
        @JsonUnwrapped BaseSegment base,
        @JsonUnwrapped PullReqSegment pullRequest,
        @JsonUnwrapped TargetReferenceSegment targetReference,
        @JsonUnwrapped ReferenceSegment reference,
        @JsonUnwrapped ReferenceDetailsSegment referenceDetails
) implements WebhookPayload {}
