package com.logistics.reconciliation.model;

/**
 * Row counts for one committed page.
 *
 * @param orphaned lines skipped because their parent header is not in Target
 */
public record PageWriteResult(int inserted, int updated, int skipped, int orphaned) {

    public static PageWriteResult empty() {
        return new PageWriteResult(0, 0, 0, 0);
    }
}
