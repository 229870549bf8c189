package com.logistics.reconciliation.model;

/**
 * The two independently owned relational stores.
 */
public enum Store {
    /**
     * Read-only system of record (Database A).
     */
    SOURCE("Source"),

    /**
     * Read-write cleansing store (Database B).
     */
    TARGET("Target");

    private final String displayName;

    Store(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
