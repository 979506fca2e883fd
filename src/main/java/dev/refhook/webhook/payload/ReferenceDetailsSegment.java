package dev.refhook.webhook.payload;

import com.fasterxml.jackson.annotation.JsonInclude;

public record ReferenceDetailsSegment(
        String sha,
        @JsonInclude(JsonInclude.Include.NON_NULL) CommitInfo commit
) {}
