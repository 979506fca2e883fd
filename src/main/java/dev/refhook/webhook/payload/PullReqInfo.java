package dev.refhook.webhook.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.refhook.domain.entity.PullReq;
import dev.refhook.domain.enums.MergeMethod;
import dev.refhook.domain.enums.PullReqState;

/**
 * Public shape of a pull request. Branch names are bare here; the reference
 * segments carry the fully qualified names.
 */
public record PullReqInfo(
        long number,
        PullReqState state,
        @JsonProperty("is_draft") boolean draft,
        String title,
        @JsonProperty("source_repo_id") long sourceRepoId,
        @JsonProperty("source_branch") String sourceBranch,
        @JsonProperty("target_repo_id") long targetRepoId,
        @JsonProperty("target_branch") String targetBranch,
        @JsonProperty("merge_strategy") @JsonInclude(JsonInclude.Include.NON_NULL) MergeMethod mergeStrategy
) {
    public static PullReqInfo from(PullReq pr) {
        return new PullReqInfo(pr.number(), pr.state(), pr.draft(), pr.title(),
                pr.sourceRepoId(), pr.sourceBranch(), pr.targetRepoId(), pr.targetBranch(),
                pr.mergeMethod());
    }
}
