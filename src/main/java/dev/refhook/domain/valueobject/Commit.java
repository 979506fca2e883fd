package dev.refhook.domain.valueobject;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Commit as resolved by the git data accessor. Never cached: a trigger always
 * resolves the SHA it is about to publish.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Commit(
        String sha,
        String title,
        String message,
        Signature author,
        Signature committer
) {}
