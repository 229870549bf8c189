package com.logistics.reconciliation.exception;

import com.logistics.reconciliation.model.Store;

/**
 * Thrown when a store cannot be reached: connection refused or lost,
 * query timeout, or the store's circuit breaker is open.
 * <p>
 * Always transient; the retry controller retries it.
 */
public class StoreUnavailableException extends ReconciliationException {

    private final Store store;
    private final String operation;

    public StoreUnavailableException(Store store, String operation, Throwable cause) {
        super(String.format("%s store unavailable during '%s': %s",
                store.getDisplayName(), operation, cause.getMessage()), cause);
        this.store = store;
        this.operation = operation;
    }

    public Store getStore() {
        return store;
    }

    public String getOperation() {
        return operation;
    }
}
