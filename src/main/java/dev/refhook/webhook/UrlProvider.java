package dev.refhook.webhook;

/**
 * Builds absolute links placed into repository projections.
 */
public interface UrlProvider {

    /** Clone URL for the repository at {@code repoPath}. */
    String gitCloneUrl(String repoPath);
}
