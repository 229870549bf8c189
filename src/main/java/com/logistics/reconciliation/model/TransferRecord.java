package com.logistics.reconciliation.model;

/**
 * A row that can be moved between stores page by page.
 */
public interface TransferRecord {

    /**
     * Stable Source sort key; pages are read in ascending order of this key.
     */
    String cursorKey();

    /**
     * Key that identifies the same logical row in Target.
     */
    String naturalKey();
}
