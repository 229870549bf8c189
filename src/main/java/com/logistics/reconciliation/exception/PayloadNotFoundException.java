package com.logistics.reconciliation.exception;

/**
 * No payload has been stored for the given do_number.
 */
public class PayloadNotFoundException extends ReconciliationException {

    private final String doNumber;

    public PayloadNotFoundException(String doNumber) {
        super("Payload result for do_number " + doNumber + " not found");
        this.doNumber = doNumber;
    }

    public String getDoNumber() {
        return doNumber;
    }
}
