package com.bastion.storage;

/**
 * Result of an indicator upsert keyed on (value, type).
 */
public enum UpsertOutcome {

    /** A new row was created */
    INSERTED,

    /** The row already existed; only its source attribution was refreshed */
    UPDATED
}
