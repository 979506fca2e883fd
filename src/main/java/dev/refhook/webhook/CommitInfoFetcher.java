package dev.refhook.webhook;

import dev.refhook.domain.valueobject.Commit;
import dev.refhook.exception.DiscardEventException;
import dev.refhook.exception.TriggerBackendException;
import dev.refhook.exception.TriggerCancelledException;
import dev.refhook.infrastructure.git.GitCommitReader;
import dev.refhook.webhook.payload.CommitInfo;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Resolves commit metadata for a trigger. One synchronous call per invocation:
 * no caching (a stale commit must never end up in a payload) and no retries.
 */
@Component
public class CommitInfoFetcher {

    private final GitCommitReader gitCommitReader;

    public CommitInfoFetcher(GitCommitReader gitCommitReader) {
        this.gitCommitReader = gitCommitReader;
    }

    public CommitInfo fetch(String repoGitUid, String sha) {
        if (sha == null || sha.isBlank()) {
            throw new DiscardEventException("event carries no commit sha");
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new TriggerCancelledException("commit lookup for sha '%s' cancelled".formatted(sha));
        }

        Optional<Commit> commit;
        try {
            commit = gitCommitReader.findCommit(repoGitUid, sha);
        } catch (RuntimeException e) {
            if (TriggerCancelledException.isCancellation(e)) {
                throw TriggerCancelledException.wrap("commit lookup for sha '%s' cancelled".formatted(sha), e);
            }
            throw new TriggerBackendException("failed to get commit info for sha '%s'".formatted(sha), e);
        }

        return commit.map(CommitInfo::from)
                .orElseThrow(() -> DiscardEventException.of("commit with sha '%s' doesn't exist", sha));
    }
}
