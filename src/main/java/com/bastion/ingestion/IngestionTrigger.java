package com.bastion.ingestion;

/**
 * What started an ingestion run.
 */
public enum IngestionTrigger {

    SCHEDULED,

    MANUAL
}
