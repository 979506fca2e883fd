package dev.refhook.webhook.payload;

import dev.refhook.domain.valueobject.Commit;

public record CommitInfo(String sha, String message, SignatureInfo author, SignatureInfo committer) {
    public static CommitInfo from(Commit commit) {
        return new CommitInfo(commit.sha(), commit.message(),
                SignatureInfo.from(commit.author()), SignatureInfo.from(commit.committer()));
    }
}
