package com.bastion.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Record of a candidate that ingestion rejected because it matched a
 * whitelist entry. Append-only.
 */
public class WhitelistBlock {

    public static final String DEFAULT_REASON = "Blocked by whitelist entry during feed processing";

    @JsonProperty("id")
    private Long id;

    @JsonProperty("value")
    private String value;

    @JsonProperty("type")
    private IndicatorType type;

    @JsonProperty("source")
    private String source;

    @JsonProperty("sourceId")
    private Long sourceId;

    @JsonProperty("sourceName")
    private String sourceName;

    @JsonProperty("whitelistEntryId")
    private Long whitelistEntryId;

    @JsonProperty("whitelistValue")
    private String whitelistValue;

    @JsonProperty("blockedReason")
    private String blockedReason;

    @JsonProperty("attemptedAt")
    private Instant attemptedAt;

    public WhitelistBlock() {
    }

    /**
     * Build the block row for a candidate coming from a feed.
     */
    public static WhitelistBlock forFeedCandidate(String value, IndicatorType type, DataSource source,
                                                  WhitelistEntry entry, Instant attemptedAt) {
        WhitelistBlock block = new WhitelistBlock();
        block.value = value;
        block.type = type;
        block.source = source.getName();
        block.sourceId = source.getId();
        block.sourceName = source.getName();
        block.whitelistEntryId = entry.getId();
        block.whitelistValue = entry.getValue();
        block.blockedReason = reasonFor(entry);
        block.attemptedAt = attemptedAt;
        return block;
    }

    public static String reasonFor(WhitelistEntry entry) {
        String reason = entry.getReason();
        if (reason == null || reason.isBlank()) {
            return DEFAULT_REASON;
        }
        return "Whitelisted: " + reason;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    public IndicatorType getType() {
        return type;
    }

    public void setType(IndicatorType type) {
        this.type = type;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public Long getSourceId() {
        return sourceId;
    }

    public void setSourceId(Long sourceId) {
        this.sourceId = sourceId;
    }

    public String getSourceName() {
        return sourceName;
    }

    public void setSourceName(String sourceName) {
        this.sourceName = sourceName;
    }

    public Long getWhitelistEntryId() {
        return whitelistEntryId;
    }

    public void setWhitelistEntryId(Long whitelistEntryId) {
        this.whitelistEntryId = whitelistEntryId;
    }

    public String getWhitelistValue() {
        return whitelistValue;
    }

    public void setWhitelistValue(String whitelistValue) {
        this.whitelistValue = whitelistValue;
    }

    public String getBlockedReason() {
        return blockedReason;
    }

    public void setBlockedReason(String blockedReason) {
        this.blockedReason = blockedReason;
    }

    public Instant getAttemptedAt() {
        return attemptedAt;
    }

    public void setAttemptedAt(Instant attemptedAt) {
        this.attemptedAt = attemptedAt;
    }
}
