package com.logistics.reconciliation.model;

import java.time.LocalDate;

/**
 * One logical order. {@code fakturId} is the natural key in Target;
 * {@code sourceOrderId} is the Source primary key and the paging key.
 */
public record OrderHeader(
        Long sourceOrderId,
        String fakturId,
        LocalDate fakturDate,
        LocalDate deliveryDate,
        String doNumber,
        String status,
        String customerId,
        String warehouseId,
        String clientId,
        String divisi,
        Address origin,
        Address destination,
        String notes,
        String createdBy
) implements TransferRecord {

    @Override
    public String cursorKey() {
        return String.valueOf(sourceOrderId);
    }

    @Override
    public String naturalKey() {
        return fakturId;
    }
}
