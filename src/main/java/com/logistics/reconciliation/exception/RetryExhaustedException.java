package com.logistics.reconciliation.exception;

/**
 * A transient failure persisted through every allowed attempt.
 */
public class RetryExhaustedException extends TransferRunException {

    private final String operation;
    private final int attempts;

    public RetryExhaustedException(String operation, int attempts, Throwable lastCause) {
        super(String.format("Operation '%s' failed after %d attempts: %s",
                operation, attempts, lastCause.getMessage()), lastCause);
        this.operation = operation;
        this.attempts = attempts;
    }

    public String getOperation() {
        return operation;
    }

    public int getAttempts() {
        return attempts;
    }
}
