package dev.refhook.webhook.payload;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.refhook.domain.entity.Repository;
import dev.refhook.webhook.UrlProvider;

public record RepositoryInfo(
        long id,
        String path,
        String uid,
        @JsonProperty("default_branch") String defaultBranch,
        @JsonProperty("git_url") String gitUrl
) {
    public static RepositoryInfo from(Repository repo, UrlProvider urlProvider) {
        return new RepositoryInfo(repo.id(), repo.path(), repo.uid(), repo.defaultBranch(),
                urlProvider.gitCloneUrl(repo.path()));
    }
}
