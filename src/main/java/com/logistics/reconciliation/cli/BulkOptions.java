package com.logistics.reconciliation.cli;

import com.logistics.reconciliation.service.transfer.TransferOptions;
import picocli.CommandLine.Option;

import java.time.Duration;

/**
 * Paging options shared by the bulk commands. Unset options keep the
 * configured defaults.
 */
public class BulkOptions {

    @Option(names = "--batch-size", description = "Rows per page (default: reconciliation.transfer.batch-size)")
    Integer batchSize;

    @Option(names = "--batch-delay", description = "Seconds to wait between pages (default: reconciliation.transfer.batch-delay)")
    Long batchDelaySeconds;

    @Option(names = "--resume-after", description = "Resume key printed by a halted run")
    String resumeAfter;

    @Option(names = "--validate", description = "Compare row counts in Source and Target after the run")
    boolean validate;

    public TransferOptions applyTo(TransferOptions defaults) {
        TransferOptions options = defaults;
        if (batchSize != null) {
            options = options.withBatchSize(batchSize);
        }
        if (batchDelaySeconds != null) {
            options = options.withBatchDelay(Duration.ofSeconds(batchDelaySeconds));
        }
        return options.withResumeAfter(resumeAfter).withValidate(validate);
    }
}
