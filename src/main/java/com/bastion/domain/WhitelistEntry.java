package com.bastion.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A value or range that must never become an active indicator.
 *
 * IP entries may be CIDR ranges. Domain entries also cover every subdomain.
 * Entries never expire.
 */
public class WhitelistEntry {

    @JsonProperty("id")
    private Long id;

    @JsonProperty("value")
    private String value;

    @JsonProperty("type")
    private IndicatorType type;

    @JsonProperty("reason")
    private String reason;

    @JsonProperty("createdAt")
    private Instant createdAt;

    @JsonProperty("createdBy")
    private Long createdBy;

    public WhitelistEntry() {
    }

    public WhitelistEntry(Long id, String value, IndicatorType type, String reason) {
        this.id = id;
        this.value = value;
        this.type = type;
        this.reason = reason;
    }

    public boolean isCidr() {
        return type == IndicatorType.IP && value != null && value.contains("/");
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

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Long getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(Long createdBy) {
        this.createdBy = createdBy;
    }

    @Override
    public String toString() {
        return "WhitelistEntry{id=" + id + ", value='" + value + "', type=" + type + "}";
    }
}
