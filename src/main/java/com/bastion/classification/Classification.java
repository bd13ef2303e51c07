package com.bastion.classification;

import com.bastion.domain.HashType;
import com.bastion.domain.IndicatorType;

import java.util.Objects;

/**
 * A feed value recognised as a specific indicator type. The value is in its
 * stored form (hashes and domains lower-cased, IPs canonicalised).
 */
public final class Classification {

    private final String value;
    private final IndicatorType type;
    private final HashType hashType;

    public Classification(String value, IndicatorType type, HashType hashType) {
        this.value = Objects.requireNonNull(value, "value");
        this.type = Objects.requireNonNull(type, "type");
        this.hashType = hashType;
    }

    public static Classification of(String value, IndicatorType type) {
        return new Classification(value, type, null);
    }

    /**
     * Same value, different type. Used to re-label a URL as soar-url.
     */
    public Classification withType(IndicatorType newType) {
        return new Classification(value, newType, hashType);
    }

    public String getValue() {
        return value;
    }

    public IndicatorType getType() {
        return type;
    }

    public HashType getHashType() {
        return hashType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Classification)) {
            return false;
        }
        Classification that = (Classification) o;
        return value.equals(that.value) && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, type);
    }

    @Override
    public String toString() {
        return type + ":" + value;
    }
}
