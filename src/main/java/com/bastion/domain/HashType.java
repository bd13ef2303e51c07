package com.bastion.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Hash algorithms recognised by hex digest length.
 */
public enum HashType {

    MD5("md5", 32),
    SHA1("sha1", 40),
    SHA256("sha256", 64),
    SHA512("sha512", 128);

    private final String value;
    private final int hexLength;

    HashType(String value, int hexLength) {
        this.value = value;
        this.hexLength = hexLength;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getHexLength() {
        return hexLength;
    }

    /**
     * Resolve the hash type for a hex digest length.
     *
     * @param length number of hex characters
     * @return the matching type, or null if no algorithm produces that length
     */
    public static HashType forHexLength(int length) {
        for (HashType type : values()) {
            if (type.hexLength == length) {
                return type;
            }
        }
        return null;
    }

    public static HashType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (HashType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown hash type: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
