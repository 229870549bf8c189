package com.logistics.reconciliation.exception;

/**
 * A permanent failure such as a constraint violation from malformed data or a
 * schema mismatch. Never retried.
 */
public class FatalTransferException extends TransferRunException {

    private final String operation;

    public FatalTransferException(String operation, Throwable cause) {
        super(String.format("Operation '%s' failed permanently: %s", operation, cause.getMessage()), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
