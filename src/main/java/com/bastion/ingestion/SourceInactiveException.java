package com.bastion.ingestion;

/**
 * A run was requested for a source that is switched off.
 */
public class SourceInactiveException extends RuntimeException {

    private final Long sourceId;

    public SourceInactiveException(Long sourceId, String sourceName) {
        super("Data source is inactive: " + sourceName);
        this.sourceId = sourceId;
    }

    public Long getSourceId() {
        return sourceId;
    }
}
