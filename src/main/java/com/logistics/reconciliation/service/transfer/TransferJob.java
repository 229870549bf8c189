package com.logistics.reconciliation.service.transfer;

import com.logistics.reconciliation.model.TransferRecord;
import com.logistics.reconciliation.model.TransferScope;
import com.logistics.reconciliation.model.WriteMode;
import com.logistics.reconciliation.repository.RecordReader;
import com.logistics.reconciliation.repository.RecordWriter;

/**
 * One table moved from Source to Target: what to read, where to write and how.
 */
public record TransferJob<T extends TransferRecord>(
        String name,
        RecordReader<T> reader,
        RecordWriter<T> writer,
        WriteMode mode,
        TransferScope scope,
        TransferOptions options
) {
}
