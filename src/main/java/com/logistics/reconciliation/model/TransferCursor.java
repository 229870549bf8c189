package com.logistics.reconciliation.model;

/**
 * Last committed page boundary of a transfer run.
 * <p>
 * Passing {@link #lastKey()} back as {@code resumeAfter} restarts the run at
 * the first page that was not committed.
 */
public record TransferCursor(String table, String lastKey, long pagesCommitted, long rowsCommitted) {

    public static TransferCursor start(String table, String resumeAfter) {
        return new TransferCursor(table, resumeAfter, 0, 0);
    }

    public TransferCursor advance(String newLastKey, int rows) {
        return new TransferCursor(table, newLastKey, pagesCommitted + 1, rowsCommitted + rows);
    }

    public boolean isAtStart() {
        return lastKey == null;
    }

    public String describe() {
        return String.format("table=%s, resume-after=%s, pages=%d, rows=%d",
                table, lastKey == null ? "<start>" : lastKey, pagesCommitted, rowsCommitted);
    }
}
