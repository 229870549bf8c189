package com.logistics.reconciliation.exception;

import com.logistics.reconciliation.model.Store;

public class SourceUnavailableException extends StoreUnavailableException {

    public SourceUnavailableException(String operation, Throwable cause) {
        super(Store.SOURCE, operation, cause);
    }
}
