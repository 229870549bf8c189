package com.logistics.reconciliation.service.retry;

import com.logistics.reconciliation.exception.StoreUnavailableException;
import com.logistics.reconciliation.exception.TransferRunException;
import com.logistics.reconciliation.exception.WriteFailedException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;

import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Decides whether a store failure is worth another attempt.
 * <p>
 * Transient: lost or refused connections, timeouts, deadlocks and serialization
 * failures, lock acquisition failures and open circuit breakers.
 * Everything else, including unique-key violations, bad SQL and schema
 * mismatches, is permanent.
 */
@Component
public class FailureClassifier {

    private static final Set<String> TRANSIENT_SQL_STATES = Set.of(
            "40001", // serialization_failure
            "40P01", // deadlock_detected
            "55P03", // lock_not_available
            "57014", // query_canceled (statement timeout)
            "57P01"  // admin_shutdown
    );

    public boolean isTransient(Throwable failure) {
        Set<Throwable> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Throwable current = failure;

        while (current != null && visited.add(current)) {
            // Run-level outcomes are final; never retry them a second time
            if (current instanceof TransferRunException) {
                return false;
            }
            if (current instanceof WriteFailedException writeFailed) {
                return writeFailed.isRetryable();
            }
            if (current instanceof DuplicateKeyException) {
                return false;
            }
            if (current instanceof StoreUnavailableException
                    || current instanceof TransientDataAccessException
                    || current instanceof RecoverableDataAccessException
                    || current instanceof DataAccessResourceFailureException
                    || current instanceof CannotCreateTransactionException) {
                return true;
            }
            if (current instanceof SQLException sqlException && isTransientSql(sqlException)) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private boolean isTransientSql(SQLException e) {
        if (e instanceof SQLTransientException || e instanceof SQLRecoverableException) {
            return true;
        }
        String state = e.getSQLState();
        if (state == null) {
            return false;
        }
        // Class 08: connection exception
        return state.startsWith("08") || TRANSIENT_SQL_STATES.contains(state);
    }
}
