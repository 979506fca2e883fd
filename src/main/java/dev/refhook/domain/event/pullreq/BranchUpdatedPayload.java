package dev.refhook.domain.event.pullreq;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Source branch of a pull request moved from {@code oldSha} to {@code newSha}.
 * {@code forced} is set when the update was not a fast-forward.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BranchUpdatedPayload(
        @JsonProperty("pullreq_id") long pullReqId,
        @JsonProperty("principal_id") long principalId,
        @JsonProperty("old_sha") String oldSha,
        @JsonProperty("new_sha") String newSha,
        boolean forced
) implements PullReqEventPayload {}
