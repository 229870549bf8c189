package com.logistics.reconciliation.entity;

/**
 * Lifecycle status of a stored order payload.
 */
public enum PayloadStatus {
    /**
     * Payload built and stored; not yet picked up downstream.
     * Re-creating a payload resets it to this state.
     */
    CREATED,

    /**
     * Payload consumed by the downstream cleansing flow.
     */
    PROCESSED,

    /**
     * Downstream processing rejected the payload.
     */
    FAILED
}
