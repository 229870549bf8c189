package com.logistics.reconciliation.exception;

/**
 * Base exception for reconciliation and transfer errors.
 */
public class ReconciliationException extends RuntimeException {

    public ReconciliationException(String message) {
        super(message);
    }

    public ReconciliationException(String message, Throwable cause) {
        super(message, cause);
    }
}
