package com.logistics.reconciliation.exception;

import com.logistics.reconciliation.model.Store;

public class TargetUnavailableException extends StoreUnavailableException {

    public TargetUnavailableException(String operation, Throwable cause) {
        super(Store.TARGET, operation, cause);
    }
}
