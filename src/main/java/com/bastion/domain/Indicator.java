package com.bastion.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A single threat artifact (IP, domain, hash or URL).
 *
 * (value, type) is unique across the whole store regardless of which feed
 * produced it. Indicators entered by hand carry source {@value #MANUAL_SOURCE}
 * and no sourceId.
 *
 * tempActiveUntil is only meaningful while the indicator is active; once it
 * passes, the sweeper deletes the row.
 */
public class Indicator {

    public static final String MANUAL_SOURCE = "manual";

    @JsonProperty("id")
    private Long id;

    @JsonProperty("value")
    private String value;

    @JsonProperty("type")
    private IndicatorType type;

    @JsonProperty("hashType")
    private HashType hashType;

    @JsonProperty("source")
    private String source;

    @JsonProperty("sourceId")
    private Long sourceId;

    @JsonProperty("isActive")
    private boolean active;

    @JsonProperty("tempActiveUntil")
    private Instant tempActiveUntil;

    /**
     * Legacy free-text notes; structured notes live in {@link IndicatorNote}
     */
    @JsonProperty("notes")
    private String notes;

    @JsonProperty("createdAt")
    private Instant createdAt;

    @JsonProperty("updatedAt")
    private Instant updatedAt;

    @JsonProperty("createdBy")
    private Long createdBy;

    public Indicator() {
        this.active = true;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Indicator indicator;

        public Builder() {
            this.indicator = new Indicator();
        }

        public Builder id(Long id) {
            indicator.id = id;
            return this;
        }

        public Builder value(String value) {
            indicator.value = value;
            return this;
        }

        public Builder type(IndicatorType type) {
            indicator.type = type;
            return this;
        }

        public Builder hashType(HashType hashType) {
            indicator.hashType = hashType;
            return this;
        }

        public Builder source(String source) {
            indicator.source = source;
            return this;
        }

        public Builder sourceId(Long sourceId) {
            indicator.sourceId = sourceId;
            return this;
        }

        public Builder active(boolean active) {
            indicator.active = active;
            return this;
        }

        public Builder tempActiveUntil(Instant tempActiveUntil) {
            indicator.tempActiveUntil = tempActiveUntil;
            return this;
        }

        public Builder notes(String notes) {
            indicator.notes = notes;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            indicator.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            indicator.updatedAt = updatedAt;
            return this;
        }

        public Builder createdBy(Long createdBy) {
            indicator.createdBy = createdBy;
            return this;
        }

        public Indicator build() {
            return indicator;
        }
    }

    public boolean isManual() {
        return MANUAL_SOURCE.equals(source);
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

    public HashType getHashType() {
        return hashType;
    }

    public void setHashType(HashType hashType) {
        this.hashType = hashType;
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

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public Instant getTempActiveUntil() {
        return tempActiveUntil;
    }

    public void setTempActiveUntil(Instant tempActiveUntil) {
        this.tempActiveUntil = tempActiveUntil;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Long getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(Long createdBy) {
        this.createdBy = createdBy;
    }

    @Override
    public String toString() {
        return "Indicator{id=" + id + ", value='" + value + "', type=" + type + ", source='" + source
            + "', active=" + active + "}";
    }
}
