package com.logistics.reconciliation.model;

/**
 * How the batch writer treats rows whose natural key already exists in Target.
 */
public enum WriteMode {
    /**
     * Existing rows are skipped. Used for first-time transfers.
     */
    INSERT_IF_ABSENT,

    /**
     * Existing rows are updated field by field, new rows are inserted.
     * Used for recurring synchronization.
     */
    MERGE
}
