package com.bastion.ingestion;

/**
 * A run was requested while another run for the same source still holds
 * the run lock.
 */
public class FetchInProgressException extends RuntimeException {

    private final Long sourceId;

    public FetchInProgressException(Long sourceId, String sourceName) {
        super("Fetch already in progress for data source: " + sourceName);
        this.sourceId = sourceId;
    }

    public Long getSourceId() {
        return sourceId;
    }
}
