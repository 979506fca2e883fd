package dev.refhook.infrastructure.git;

import dev.refhook.domain.valueobject.Commit;

import java.util.Optional;

/**
 * Git data access. Empty when the repository has no commit with that SHA;
 * any other failure is thrown.
 */
public interface GitCommitReader {
    Optional<Commit> findCommit(String repoGitUid, String sha);
}
