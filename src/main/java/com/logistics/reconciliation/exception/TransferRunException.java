package com.logistics.reconciliation.exception;

import com.logistics.reconciliation.model.TransferCursor;

/**
 * Terminal failure of a transfer run. Carries the cursor of the last
 * committed page once the engine has attached it, so an operator can resume.
 */
public abstract class TransferRunException extends ReconciliationException {

    private TransferCursor cursor;

    protected TransferRunException(String message) {
        super(message);
    }

    protected TransferRunException(String message, Throwable cause) {
        super(message, cause);
    }

    public TransferCursor getCursor() {
        return cursor;
    }

    public void setCursor(TransferCursor cursor) {
        this.cursor = cursor;
    }

    @Override
    public String getMessage() {
        if (cursor == null) {
            return super.getMessage();
        }
        return super.getMessage() + " [" + cursor.describe() + "]";
    }
}
