package dev.refhook.webhook.payload;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TargetReferenceSegment(@JsonProperty("target_ref") ReferenceInfo targetRef) {}
