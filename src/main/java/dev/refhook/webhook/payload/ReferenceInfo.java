package dev.refhook.webhook.payload;

/**
 * A git reference scoped to the repository it lives in. For fork-based pull requests
 * the source and target references point at different repositories.
 */
public record ReferenceInfo(String name, RepositoryInfo repo) {

    /** Namespace of branch references. */
    public static final String BRANCH_PREFIX = "refs/heads/";

    /**
     * Reference for a branch. The name is always qualified, slashes in the branch
     * name are kept as they are.
     */
    public static ReferenceInfo branch(String branch, RepositoryInfo repo) {
        if (branch == null || branch.isEmpty()) throw new IllegalArgumentException("branch name required");
        return new ReferenceInfo(BRANCH_PREFIX + branch, repo);
    }
}
