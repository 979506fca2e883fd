package dev.refhook.domain.event.pullreq;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MergedPayload(
        @JsonProperty("pullreq_id") long pullReqId,
        @JsonProperty("principal_id") long principalId,
        @JsonProperty("source_sha") String sourceSha,
        @JsonProperty("merge_sha") String mergeSha
) implements PullReqEventPayload {}
