package com.bastion.ingestion;

/**
 * A run was requested for a source that is paused.
 */
public class SourcePausedException extends RuntimeException {

    private final Long sourceId;

    public SourcePausedException(Long sourceId, String sourceName) {
        super("Data source is paused: " + sourceName);
        this.sourceId = sourceId;
    }

    public Long getSourceId() {
        return sourceId;
    }
}
