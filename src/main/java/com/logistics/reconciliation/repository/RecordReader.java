package com.logistics.reconciliation.repository;

import com.logistics.reconciliation.model.TransferRecord;
import com.logistics.reconciliation.model.TransferScope;

import java.util.List;

/**
 * Keyset-paginated reader over one Source table.
 */
public interface RecordReader<T extends TransferRecord> {

    String table();

    /**
     * Next page of rows with a cursor key strictly greater than {@code afterKey},
     * ascending. A page shorter than {@code pageSize} is the last one.
     *
     * @param afterKey cursor key of the last row already processed, or null to start
     */
    List<T> readPage(TransferScope scope, String afterKey, int pageSize);

    long count(TransferScope scope);

    /**
     * Rejects a resume key that cannot be a cursor key of this table.
     */
    default void checkResumeKey(String resumeAfter) {
    }
}
