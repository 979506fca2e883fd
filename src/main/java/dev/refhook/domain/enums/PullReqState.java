package dev.refhook.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle: OPEN → CLOSED (→ OPEN on reopen) | MERGED
 */
public enum PullReqState {
    OPEN("open"), CLOSED("closed"), MERGED("merged");

    private final String value;
    PullReqState(String value) { this.value = value; }

    @JsonValue
    public String value() { return value; }

    public static PullReqState fromValue(String value) {
        for (PullReqState state : values()) {
            if (state.value.equals(value)) return state;
        }
        throw new IllegalArgumentException("Unknown pull request state: " + value);
    }
}
