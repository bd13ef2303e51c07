package com.bastion.indicator;

/**
 * A manually entered indicator matches a whitelist entry.
 */
public class WhitelistedIndicatorException extends RuntimeException {

    private final String whitelistValue;

    public WhitelistedIndicatorException(String value, String whitelistValue) {
        super("Indicator is whitelisted: " + value);
        this.whitelistValue = whitelistValue;
    }

    public String getWhitelistValue() {
        return whitelistValue;
    }
}
