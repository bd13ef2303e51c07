package com.bastion.indicator;

import com.bastion.domain.IndicatorType;

public class DuplicateIndicatorException extends RuntimeException {

    private final String value;
    private final IndicatorType type;

    public DuplicateIndicatorException(String value, IndicatorType type) {
        super("Indicator already exists: " + type + " " + value);
        this.value = value;
        this.type = type;
    }

    public String getValue() {
        return value;
    }

    public IndicatorType getType() {
        return type;
    }
}
