package com.bastion.ingestion;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Counters for one ingestion run. Filled in by the worker thread that owns
 * the run; not shared.
 */
public class IngestionSummary {

    @JsonProperty("sourceId")
    private final Long sourceId;

    @JsonProperty("sourceName")
    private final String sourceName;

    @JsonProperty("trigger")
    private final IngestionTrigger trigger;

    @JsonProperty("startedAt")
    private final Instant startedAt;

    @JsonProperty("finishedAt")
    private Instant finishedAt;

    @JsonProperty("fetchSucceeded")
    private boolean fetchSucceeded;

    @JsonProperty("error")
    private String error;

    @JsonProperty("lines")
    private int lines;

    @JsonProperty("candidates")
    private int candidates;

    @JsonProperty("inserted")
    private int inserted;

    @JsonProperty("duplicates")
    private int duplicates;

    @JsonProperty("blocked")
    private int blocked;

    @JsonProperty("discarded")
    private int discarded;

    @JsonProperty("failed")
    private int failed;

    public IngestionSummary(Long sourceId, String sourceName, IngestionTrigger trigger, Instant startedAt) {
        this.sourceId = sourceId;
        this.sourceName = sourceName;
        this.trigger = trigger;
        this.startedAt = startedAt;
    }

    void fetchSucceeded(int lineCount) {
        this.fetchSucceeded = true;
        this.lines = lineCount;
    }

    void failed(String error) {
        this.error = error;
    }

    void finish(Instant finishedAt) {
        this.finishedAt = finishedAt;
    }

    void candidates(int candidates) {
        this.candidates = candidates;
    }

    void incrementInserted() {
        inserted++;
    }

    void incrementDuplicates() {
        duplicates++;
    }

    void incrementBlocked() {
        blocked++;
    }

    void incrementDiscarded() {
        discarded++;
    }

    void incrementFailed() {
        failed++;
    }

    /**
     * Counts in the shape stored as audit metadata.
     */
    public Map<String, Object> toAuditMetadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("trigger", trigger.name().toLowerCase(Locale.ROOT));
        metadata.put("totalLines", lines);
        metadata.put("candidates", candidates);
        metadata.put("inserted", inserted);
        metadata.put("duplicates", duplicates);
        metadata.put("whitelistBlocked", blocked);
        metadata.put("discarded", discarded);
        metadata.put("failed", failed);
        return metadata;
    }

    public boolean isSuccess() {
        return fetchSucceeded && error == null;
    }

    public Long getSourceId() {
        return sourceId;
    }

    public String getSourceName() {
        return sourceName;
    }

    public IngestionTrigger getTrigger() {
        return trigger;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public boolean isFetchSucceeded() {
        return fetchSucceeded;
    }

    public String getError() {
        return error;
    }

    public int getLines() {
        return lines;
    }

    public int getCandidates() {
        return candidates;
    }

    public int getInserted() {
        return inserted;
    }

    public int getDuplicates() {
        return duplicates;
    }

    public int getBlocked() {
        return blocked;
    }

    public int getDiscarded() {
        return discarded;
    }

    public int getFailed() {
        return failed;
    }

    @Override
    public String toString() {
        return "IngestionSummary{source='" + sourceName + "', trigger=" + trigger + ", lines=" + lines
            + ", candidates=" + candidates + ", inserted=" + inserted + ", duplicates=" + duplicates
            + ", blocked=" + blocked + ", discarded=" + discarded + ", failed=" + failed
            + (error != null ? ", error='" + error + "'" : "") + "}";
    }
}
