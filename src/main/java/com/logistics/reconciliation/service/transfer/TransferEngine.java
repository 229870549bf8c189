package com.logistics.reconciliation.service.transfer;

import com.logistics.reconciliation.dto.TransferResult;
import com.logistics.reconciliation.dto.ValidationReport;
import com.logistics.reconciliation.exception.TransferRunException;
import com.logistics.reconciliation.model.PageRange;
import com.logistics.reconciliation.model.PageWriteResult;
import com.logistics.reconciliation.model.TransferCursor;
import com.logistics.reconciliation.model.TransferRecord;
import com.logistics.reconciliation.repository.RecordReader;
import com.logistics.reconciliation.repository.RecordWriter;
import com.logistics.reconciliation.service.ValidationService;
import com.logistics.reconciliation.service.retry.RetryController;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Drives a transfer: reads Source pages in key order, writes each one to
 * Target through the {@link BatchWriter}, and pauses between pages.
 * <p>
 * Page reads and writes run under the {@link RetryController}. The cursor
 * advances only after a page commits, so a halted run can be resumed from
 * the cursor attached to its exception.
 */
@Component
@Slf4j
public class TransferEngine {

    private final BatchWriter batchWriter;
    private final RetryController retryController;
    private final ValidationService validationService;
    private final CancellationRegistry cancellationRegistry;
    private final MeterRegistry meterRegistry;

    // Metrics
    private Counter pagesCounter;
    private Counter rowsCounter;
    private Counter haltedCounter;
    private Timer transferTimer;

    public TransferEngine(BatchWriter batchWriter,
                          RetryController retryController,
                          ValidationService validationService,
                          CancellationRegistry cancellationRegistry,
                          MeterRegistry meterRegistry) {
        this.batchWriter = batchWriter;
        this.retryController = retryController;
        this.validationService = validationService;
        this.cancellationRegistry = cancellationRegistry;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        pagesCounter = Counter.builder("reconciliation.transfer.pages")
                .description("Pages committed to the Target store")
                .register(meterRegistry);

        rowsCounter = Counter.builder("reconciliation.transfer.rows")
                .description("Source rows processed by committed pages")
                .register(meterRegistry);

        haltedCounter = Counter.builder("reconciliation.transfer.halted")
                .description("Transfer runs halted by failure or cancellation")
                .register(meterRegistry);

        transferTimer = Timer.builder("reconciliation.transfer.duration")
                .description("Time taken to complete a transfer run")
                .register(meterRegistry);
    }

    public <T extends TransferRecord> TransferResult run(TransferJob<T> job) {
        RecordReader<T> reader = job.reader();
        RecordWriter<T> writer = job.writer();
        TransferOptions options = job.options();

        reader.checkResumeKey(options.resumeAfter());

        TransferResult result = TransferResult.builder()
                .table(writer.table())
                .mode(job.mode())
                .scope(job.scope().toString())
                .startedAt(LocalDateTime.now())
                .build();
        TransferCursor cursor = TransferCursor.start(writer.table(), options.resumeAfter());

        log.info("Starting {}: {} -> {} in {} mode, scope {}, batch size {}, batch delay {}, resume after {}",
                job.name(), reader.table(), writer.table(), job.mode(), job.scope(),
                options.batchSize(), options.batchDelay(), cursor.isAtStart() ? "<start>" : cursor.lastKey());

        CancellationToken token = cancellationRegistry.open(job.name());
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            while (true) {
                token.throwIfCancelled("page " + (cursor.pagesCommitted() + 1) + " of " + job.name());

                String afterKey = cursor.lastKey();
                List<T> rows = retryController.execute(
                        "read " + reader.table() + " after " + (afterKey == null ? "<start>" : afterKey),
                        options.retryPolicy(), token,
                        () -> reader.readPage(job.scope(), afterKey, options.batchSize()));
                if (rows.isEmpty()) {
                    break;
                }

                PageRange range = new PageRange(cursor.pagesCommitted() + 1,
                        rows.get(0).cursorKey(), rows.get(rows.size() - 1).cursorKey(), rows.size());
                PageWriteResult written = retryController.execute(
                        "write " + writer.table() + " page " + range,
                        options.retryPolicy(), token,
                        () -> batchWriter.write(writer, rows, job.mode(), range));

                cursor = cursor.advance(range.lastKey(), rows.size());
                result.add(written);
                pagesCounter.increment();
                rowsCounter.increment(rows.size());
                log.info("Committed {} page {}: inserted={}, updated={}, skipped={}, orphaned={}; total rows {}",
                        writer.table(), range, written.inserted(), written.updated(), written.skipped(),
                        written.orphaned(), cursor.rowsCommitted());

                if (rows.size() < options.batchSize()) {
                    break;
                }
                token.await(options.batchDelay());
            }
        } catch (TransferRunException e) {
            e.setCursor(cursor);
            haltedCounter.increment();
            log.error("{} halted: {}", job.name(), e.getMessage());
            throw e;
        } finally {
            sample.stop(transferTimer);
            cancellationRegistry.close(token);
        }

        result.setCursor(cursor);
        result.setCompletedAt(LocalDateTime.now());
        log.info("Completed {} in {}ms: {} pages, {} rows, inserted={}, updated={}, skipped={}, orphaned={}",
                job.name(), result.getDurationMs(), cursor.pagesCommitted(), cursor.rowsCommitted(),
                result.getInserted(), result.getUpdated(), result.getSkipped(), result.getOrphaned());

        if (options.validate()) {
            result.setValidation(validateQuietly(job));
        }
        return result;
    }

    private <T extends TransferRecord> ValidationReport validateQuietly(TransferJob<T> job) {
        try {
            return validationService.validate(job.reader(), job.writer(), job.scope());
        } catch (TransferRunException e) {
            // Advisory only; the pages are already committed
            log.warn("Validation after {} could not run: {}", job.name(), e.getMessage());
            return null;
        }
    }
}
