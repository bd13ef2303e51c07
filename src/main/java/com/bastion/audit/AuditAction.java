package com.bastion.audit;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Actions recorded in the audit log by the pipeline and its REST surface.
 */
public enum AuditAction {

    FETCH("fetch"),

    CREATE("create"),

    UPDATE("update"),

    DELETE("delete"),

    BLOCKED("blocked"),

    TEMP_ACTIVATE("temp_activate"),

    CLEANUP("cleanup"),

    PAUSE("pause"),

    RESUME("resume"),

    MANUAL_FETCH("manual_fetch"),

    REFRESH("refresh");

    private final String value;

    AuditAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static AuditAction fromValue(String value) {
        for (AuditAction action : values()) {
            if (action.value.equalsIgnoreCase(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown audit action: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
