package com.logistics.reconciliation.repository;

import com.logistics.reconciliation.model.PageWriteResult;
import com.logistics.reconciliation.model.TransferRecord;
import com.logistics.reconciliation.model.TransferScope;
import com.logistics.reconciliation.model.WriteMode;

import java.util.List;

/**
 * Applies pages of records to one Target table.
 * Implementations do not manage transactions; callers wrap each page in one.
 */
public interface RecordWriter<T extends TransferRecord> {

    String table();

    PageWriteResult writePage(List<T> page, WriteMode mode);

    long count(TransferScope scope);
}
