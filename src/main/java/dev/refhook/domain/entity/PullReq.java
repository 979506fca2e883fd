package dev.refhook.domain.entity;

import dev.refhook.domain.enums.MergeMethod;
import dev.refhook.domain.enums.PullReqState;

/**
 * Pull request snapshot. Source and target repository differ for fork-based flows.
 * {@code mergeMethod} is null until the pull request is merged.
 */
public record PullReq(
        long id,
        long number,
        PullReqState state,
        boolean draft,
        String title,
        String description,
        long sourceRepoId,
        String sourceBranch,
        long targetRepoId,
        String targetBranch,
        MergeMethod mergeMethod,
        long created,
        long updated
) {}
