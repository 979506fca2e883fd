package dev.refhook.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PrincipalType {
    USER("user"), SERVICE("service"), SERVICE_ACCOUNT("serviceaccount");

    private final String value;
    PrincipalType(String value) { this.value = value; }

    @JsonValue
    public String value() { return value; }

    public static PrincipalType fromValue(String value) {
        for (PrincipalType type : values()) {
            if (type.value.equals(value)) return type;
        }
        throw new IllegalArgumentException("Unknown principal type: " + value);
    }
}
