package dev.refhook.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Reasons a webhook fires. Subscribers match on the wire value, so existing values
 * are never renamed; a new pull-request lifecycle kind gets a new constant.
 */
public enum WebhookTrigger {
    PULLREQ_CREATED("pullreq_created"),
    PULLREQ_REOPENED("pullreq_reopened"),
    PULLREQ_BRANCH_UPDATED("pullreq_branch_updated"),
    PULLREQ_CLOSED("pullreq_closed"),
    PULLREQ_MERGED("pullreq_merged");

    private final String value;

    WebhookTrigger(String value) { this.value = value; }

    @JsonValue
    public String value() { return value; }
}
