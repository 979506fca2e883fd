package dev.refhook.domain.entity;

/**
 * Repository as held by the repository store. {@code gitUid} is the identity the git
 * data accessor knows the repository by; {@code path} is the user-facing location.
 */
public record Repository(
        long id,
        long parentId,
        String uid,
        String path,
        String gitUid,
        String defaultBranch,
        boolean isPublic,
        long created,
        long updated
) {}
