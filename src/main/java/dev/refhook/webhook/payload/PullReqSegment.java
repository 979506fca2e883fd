package dev.refhook.webhook.payload;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PullReqSegment(@JsonProperty("pull_req") PullReqInfo pullReq) {}
