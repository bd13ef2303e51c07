package com.bastion.export;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * What one export generation published.
 */
public class ExportReport {

    @JsonProperty("generatedAt")
    private final Instant generatedAt;

    @JsonProperty("durationMs")
    private long durationMs;

    @JsonProperty("files")
    private final Map<ExportTarget, Integer> files = new EnumMap<>(ExportTarget.class);

    @JsonProperty("entries")
    private final Map<ExportTarget, Integer> entries = new EnumMap<>(ExportTarget.class);

    @JsonProperty("errors")
    private final List<String> errors = new ArrayList<>();

    public ExportReport(Instant generatedAt) {
        this.generatedAt = generatedAt;
    }

    void published(ExportTarget target, int fileCount, int entryCount) {
        files.put(target, fileCount);
        entries.put(target, entryCount);
    }

    void failed(ExportTarget target, String message) {
        errors.add(target.getPrefix() + ": " + message);
    }

    void finish(Duration elapsed) {
        this.durationMs = elapsed.toMillis();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public int fileCount(ExportTarget target) {
        return files.getOrDefault(target, 0);
    }

    public int entryCount(ExportTarget target) {
        return entries.getOrDefault(target, 0);
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public Map<ExportTarget, Integer> getFiles() {
        return files;
    }

    public Map<ExportTarget, Integer> getEntries() {
        return entries;
    }

    public List<String> getErrors() {
        return errors;
    }

    @Override
    public String toString() {
        return "ExportReport{files=" + files + ", entries=" + entries + ", errors=" + errors.size()
            + ", durationMs=" + durationMs + "}";
    }
}
