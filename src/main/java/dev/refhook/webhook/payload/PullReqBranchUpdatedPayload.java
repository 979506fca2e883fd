package dev.refhook.webhook.payload;

import com.fasterxml.jackson.annotation.JsonUnwrapped;

/**
 * Body of the {@code pullreq_branch_updated} trigger. {@code referenceDetails} describes
 * the new head of the source branch, {@code referenceUpdate} the head it replaced.
 */
public record PullReqBranchUpdatedPayload(
        @JsonUnwrapped BaseSegment base,
        @JsonUnwrapped PullReqSegment pullRequest,
        @JsonUnwrapped TargetReferenceSegment targetReference,
        @JsonUnwrapped ReferenceSegment reference,
        @JsonUnwrapped ReferenceDetailsSegment referenceDetails,
        @JsonUnwrapped ReferenceUpdateSegment referenceUpdate
) implements WebhookPayload {}
