package dev.refhook.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MergeMethod {
    MERGE("merge"), SQUASH("squash"), REBASE("rebase");

    private final String value;
    MergeMethod(String value) { this.value = value; }

    @JsonValue
    public String value() { return value; }

    /** Returns null for a null or blank column, the pull request has not been merged yet. */
    public static MergeMethod fromValue(String value) {
        if (value == null || value.isBlank()) return null;
        for (MergeMethod method : values()) {
            if (method.value.equals(value)) return method;
        }
        throw new IllegalArgumentException("Unknown merge method: " + value);
    }
}
