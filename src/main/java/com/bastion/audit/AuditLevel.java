package com.bastion.audit;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AuditLevel {

    INFO("info"),

    WARNING("warning"),

    ERROR("error");

    private final String value;

    AuditLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static AuditLevel fromValue(String value) {
        for (AuditLevel level : values()) {
            if (level.value.equalsIgnoreCase(value)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown audit level: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
