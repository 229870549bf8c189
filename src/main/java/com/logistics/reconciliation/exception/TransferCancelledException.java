package com.logistics.reconciliation.exception;

/**
 * The run was cancelled by the operator between pages or while backing off.
 */
public class TransferCancelledException extends TransferRunException {

    public TransferCancelledException(String message) {
        super(message);
    }

    public TransferCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
