package com.bastion.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of the most recent fetch of a data source.
 */
public enum FetchStatus {

    SUCCESS("success"),

    ERROR("error");

    private final String value;

    FetchStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static FetchStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (FetchStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown fetch status: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
