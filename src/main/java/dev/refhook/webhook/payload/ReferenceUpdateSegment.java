package dev.refhook.webhook.payload;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ReferenceUpdateSegment(@JsonProperty("old_sha") String oldSha, boolean forced) {}
