package com.logistics.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.logistics.reconciliation.model.PageWriteResult;
import com.logistics.reconciliation.model.TransferCursor;
import com.logistics.reconciliation.model.WriteMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Captures the outcome of one completed transfer run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransferResult {

    private String table;

    private WriteMode mode;

    private String scope;

    @JsonProperty("started_at")
    private LocalDateTime startedAt;

    @JsonProperty("completed_at")
    private LocalDateTime completedAt;

    @Builder.Default
    private long inserted = 0;

    @Builder.Default
    private long updated = 0;

    @Builder.Default
    private long skipped = 0;

    @Builder.Default
    private long orphaned = 0;

    private TransferCursor cursor;

    private ValidationReport validation;

    public void add(PageWriteResult page) {
        inserted += page.inserted();
        updated += page.updated();
        skipped += page.skipped();
        orphaned += page.orphaned();
    }

    @JsonProperty("rows_read")
    public long getRowsRead() {
        return cursor == null ? 0 : cursor.rowsCommitted();
    }

    @JsonProperty("pages_committed")
    public long getPagesCommitted() {
        return cursor == null ? 0 : cursor.pagesCommitted();
    }

    @JsonProperty("duration_ms")
    public long getDurationMs() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return Duration.between(startedAt, completedAt).toMillis();
    }
}
