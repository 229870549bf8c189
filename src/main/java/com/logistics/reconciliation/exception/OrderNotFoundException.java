package com.logistics.reconciliation.exception;

/**
 * No outbound document exists in the Target store for the given do_number.
 */
public class OrderNotFoundException extends ReconciliationException {

    private final String doNumber;

    public OrderNotFoundException(String doNumber) {
        super("Document with do_number " + doNumber + " not found in Target store");
        this.doNumber = doNumber;
    }

    public String getDoNumber() {
        return doNumber;
    }
}
