package com.logistics.reconciliation.service.retry;

import com.logistics.reconciliation.exception.FatalTransferException;
import com.logistics.reconciliation.exception.SourceUnavailableException;
import com.logistics.reconciliation.exception.WriteFailedException;
import com.logistics.reconciliation.model.PageRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.UncategorizedSQLException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;

import static org.assertj.core.api.Assertions.assertThat;

class FailureClassifierTest {

    private final FailureClassifier classifier = new FailureClassifier();

    @Nested
    @DisplayName("Transient failures")
    class TransientFailures {

        @Test
        @DisplayName("Connection and timeout failures are transient")
        void connectionFailuresAreTransient() {
            assertThat(classifier.isTransient(new QueryTimeoutException("statement timeout"))).isTrue();
            assertThat(classifier.isTransient(new CannotCreateTransactionException("pool exhausted"))).isTrue();
            assertThat(classifier.isTransient(new SQLTransientConnectionException("refused"))).isTrue();
            assertThat(classifier.isTransient(new SourceUnavailableException("read", new RuntimeException("down"))))
                    .isTrue();
        }

        @Test
        @DisplayName("Deadlock and connection SQL states are transient, also when wrapped")
        void sqlStatesAreTransient() {
            SQLException deadlock = new SQLException("deadlock detected", "40P01");
            SQLException connection = new SQLException("connection closed", "08006");

            assertThat(classifier.isTransient(new UncategorizedSQLException("write", "INSERT", deadlock))).isTrue();
            assertThat(classifier.isTransient(new RuntimeException(connection))).isTrue();
        }
    }

    @Nested
    @DisplayName("Permanent failures")
    class PermanentFailures {

        @Test
        @DisplayName("Bad data and bad SQL are permanent")
        void badDataIsPermanent() {
            assertThat(classifier.isTransient(new DataIntegrityViolationException("value too long"))).isFalse();
            assertThat(classifier.isTransient(
                    new BadSqlGrammarException("read", "SELECT", new SQLException("no column", "42703")))).isFalse();
            assertThat(classifier.isTransient(new IllegalStateException("bug"))).isFalse();
            assertThat(classifier.isTransient(null)).isFalse();
        }

        @Test
        @DisplayName("Unique-key violations are permanent, even with a transient-looking cause")
        void duplicateKeyIsPermanent() {
            SQLException uniqueViolation = new SQLException("duplicate key value", "23505");
            SQLException connection = new SQLException("connection reset", "08006");

            assertThat(classifier.isTransient(new DuplicateKeyException("uq_order_main_faktur_id", uniqueViolation)))
                    .isFalse();
            assertThat(classifier.isTransient(new DuplicateKeyException("uq_order_main_faktur_id", connection)))
                    .isFalse();
        }

        @Test
        @DisplayName("Run-level outcomes are never retried")
        void runOutcomesArePermanent() {
            FatalTransferException fatal = new FatalTransferException("write", new QueryTimeoutException("timeout"));

            assertThat(classifier.isTransient(fatal)).isFalse();
        }

        @Test
        @DisplayName("A failed page write carries its own verdict")
        void writeFailedCarriesVerdict() {
            PageRange range = new PageRange(1, "A", "B", 2);

            assertThat(classifier.isTransient(new WriteFailedException("mst_product_main", range,
                    new RuntimeException("x"), true))).isTrue();
            assertThat(classifier.isTransient(new WriteFailedException("mst_product_main", range,
                    new QueryTimeoutException("timeout"), false))).isFalse();
        }
    }
}
