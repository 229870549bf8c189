package com.logistics.reconciliation.exception;

import com.logistics.reconciliation.model.PageRange;

/**
 * A page write was aborted and its transaction rolled back.
 * Nothing from the page is persisted.
 */
public class WriteFailedException extends ReconciliationException {

    private final String table;
    private final PageRange pageRange;
    private final boolean isRetryable;

    public WriteFailedException(String table, PageRange pageRange, Throwable cause, boolean isRetryable) {
        super(String.format("Write to %s failed for page %s: %s", table, pageRange, cause.getMessage()), cause);
        this.table = table;
        this.pageRange = pageRange;
        this.isRetryable = isRetryable;
    }

    public String getTable() {
        return table;
    }

    public PageRange getPageRange() {
        return pageRange;
    }

    /**
     * True when the cause is transient (connectivity, timeout, deadlock)
     * and writing the same page again may succeed.
     */
    public boolean isRetryable() {
        return isRetryable;
    }
}
