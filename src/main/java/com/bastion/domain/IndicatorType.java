package com.bastion.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of threat artifacts tracked by the aggregator.
 *
 * The string value is what is persisted in the store and exchanged over the
 * REST API. SOAR_URL is a custom URL variant that is only recognised when it is
 * enabled system-wide and declared on the owning data source.
 */
public enum IndicatorType {

    IP("ip"),

    DOMAIN("domain"),

    HASH("hash"),

    URL("url"),

    /**
     * URL destined for SOAR playbooks rather than web proxies.
     */
    SOAR_URL("soar-url");

    private final String value;

    IndicatorType(String value) {
        this.value = value;
    }

    /**
     * Get the string value of the type
     *
     * @return String representation used in storage and the API
     */
    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parse a string value to IndicatorType
     *
     * @param value String value to parse
     * @return IndicatorType enum value
     * @throws IllegalArgumentException if value is not recognized
     */
    @JsonCreator
    public static IndicatorType fromValue(String value) {
        for (IndicatorType type : IndicatorType.values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown indicator type: " + value);
    }

    /**
     * Whether values of this type are URLs (plain or SOAR).
     */
    public boolean isUrlFamily() {
        return this == URL || this == SOAR_URL;
    }

    @Override
    public String toString() {
        return value;
    }
}
