package com.bastion.whitelist;

import com.bastion.domain.IndicatorType;
import com.bastion.domain.WhitelistEntry;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Answer to a manual whitelist check.
 */
public class WhitelistCheckResult {

    @JsonProperty("value")
    private final String value;

    @JsonProperty("type")
    private final IndicatorType type;

    @JsonProperty("whitelisted")
    private final boolean whitelisted;

    @JsonProperty("matchedEntry")
    private final WhitelistEntry matchedEntry;

    public WhitelistCheckResult(String value, IndicatorType type, WhitelistEntry matchedEntry) {
        this.value = value;
        this.type = type;
        this.whitelisted = matchedEntry != null;
        this.matchedEntry = matchedEntry;
    }

    public String getValue() {
        return value;
    }

    public IndicatorType getType() {
        return type;
    }

    public boolean isWhitelisted() {
        return whitelisted;
    }

    public WhitelistEntry getMatchedEntry() {
        return matchedEntry;
    }
}
