package com.logistics.reconciliation.service.transfer;

import com.logistics.reconciliation.exception.WriteFailedException;
import com.logistics.reconciliation.model.PageRange;
import com.logistics.reconciliation.model.PageWriteResult;
import com.logistics.reconciliation.model.TransferRecord;
import com.logistics.reconciliation.model.WriteMode;
import com.logistics.reconciliation.repository.RecordWriter;
import com.logistics.reconciliation.service.retry.FailureClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

/**
 * Applies one page to Target inside its own transaction.
 * <p>
 * A page either commits completely or rolls back completely; any failure
 * surfaces as {@link WriteFailedException} tagged with whether writing the
 * same page again may succeed.
 */
@Component
@Slf4j
public class BatchWriter {

    private final TransactionTemplate transactionTemplate;
    private final FailureClassifier failureClassifier;

    public BatchWriter(@Qualifier("pageTransactionTemplate") TransactionTemplate transactionTemplate,
                       FailureClassifier failureClassifier) {
        this.transactionTemplate = transactionTemplate;
        this.failureClassifier = failureClassifier;
    }

    public <T extends TransferRecord> PageWriteResult write(RecordWriter<T> writer, List<T> page,
                                                            WriteMode mode, PageRange range) {
        try {
            PageWriteResult result = transactionTemplate.execute(status -> writer.writePage(page, mode));
            return result == null ? PageWriteResult.empty() : result;
        } catch (RuntimeException e) {
            boolean retryable = failureClassifier.isTransient(e);
            log.warn("Rolled back {} page {} ({}): {}", writer.table(), range,
                    retryable ? "transient" : "permanent", e.getMessage());
            throw new WriteFailedException(writer.table(), range, e, retryable);
        }
    }
}
