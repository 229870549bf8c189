package com.logistics.reconciliation.repository;

import com.logistics.reconciliation.exception.SourceUnavailableException;
import com.logistics.reconciliation.exception.StoreUnavailableException;
import com.logistics.reconciliation.exception.TargetUnavailableException;
import com.logistics.reconciliation.model.Store;
import com.logistics.reconciliation.service.retry.FailureClassifier;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.springframework.dao.DataAccessException;

import java.util.function.Supplier;

/**
 * Runs store reads and turns connectivity problems into
 * {@link StoreUnavailableException} for the owning store.
 * <p>
 * When a circuit breaker is attached, calls fail fast while it is open.
 */
public class StoreGuard {

    private final Store store;
    private final CircuitBreaker circuitBreaker;
    private final FailureClassifier failureClassifier;

    public StoreGuard(Store store, CircuitBreaker circuitBreaker, FailureClassifier failureClassifier) {
        this.store = store;
        this.circuitBreaker = circuitBreaker;
        this.failureClassifier = failureClassifier;
    }

    public Store getStore() {
        return store;
    }

    public <T> T call(String operation, Supplier<T> action) {
        try {
            if (circuitBreaker == null) {
                return action.get();
            }
            return circuitBreaker.executeSupplier(action);
        } catch (CallNotPermittedException e) {
            throw unavailable(operation, e);
        } catch (DataAccessException e) {
            if (failureClassifier.isTransient(e)) {
                throw unavailable(operation, e);
            }
            throw e;
        }
    }

    private StoreUnavailableException unavailable(String operation, Throwable cause) {
        return store == Store.SOURCE
                ? new SourceUnavailableException(operation, cause)
                : new TargetUnavailableException(operation, cause);
    }
}
