package com.logistics.reconciliation.service.transfer;

import com.logistics.reconciliation.config.ReconciliationProperties;
import com.logistics.reconciliation.service.retry.RetryPolicy;

import java.time.Duration;

/**
 * Per-run knobs of a transfer.
 *
 * @param batchSize   rows per page, at least 1
 * @param batchDelay  pause between committed pages
 * @param resumeAfter cursor key of the last committed page of an earlier run, or null
 * @param validate    compare row counts in both stores once the run completes
 * @param retryPolicy retry policy for every page read and write
 */
public record TransferOptions(
        int batchSize,
        Duration batchDelay,
        String resumeAfter,
        boolean validate,
        RetryPolicy retryPolicy
) {

    public TransferOptions {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be at least 1, was " + batchSize);
        }
        if (batchDelay == null || batchDelay.isNegative()) {
            throw new IllegalArgumentException("Batch delay must be zero or positive");
        }
        if (resumeAfter != null && resumeAfter.isBlank()) {
            resumeAfter = null;
        }
        if (retryPolicy == null) {
            retryPolicy = RetryPolicy.noRetry();
        }
    }

    public static TransferOptions defaults(ReconciliationProperties properties) {
        return new TransferOptions(
                properties.getTransfer().getBatchSize(),
                properties.getTransfer().getBatchDelay(),
                null,
                false,
                properties.getRetry().toPolicy());
    }

    public TransferOptions withBatchSize(int newBatchSize) {
        return new TransferOptions(newBatchSize, batchDelay, resumeAfter, validate, retryPolicy);
    }

    public TransferOptions withBatchDelay(Duration newBatchDelay) {
        return new TransferOptions(batchSize, newBatchDelay, resumeAfter, validate, retryPolicy);
    }

    public TransferOptions withResumeAfter(String newResumeAfter) {
        return new TransferOptions(batchSize, batchDelay, newResumeAfter, validate, retryPolicy);
    }

    public TransferOptions withValidate(boolean newValidate) {
        return new TransferOptions(batchSize, batchDelay, resumeAfter, newValidate, retryPolicy);
    }
}
