package com.logistics.reconciliation.model;

import java.time.LocalDate;

/**
 * Logical slice of a table selected for transfer or validation.
 * Dates are inclusive calendar dates on the invoice (faktur) date; any part may be null.
 */
public record TransferScope(LocalDate startDate, LocalDate endDate, String warehouseId) {

    public TransferScope {
        if (startDate != null && endDate != null && startDate.isAfter(endDate)) {
            throw new IllegalArgumentException("Start date " + startDate + " is after end date " + endDate);
        }
        if (warehouseId != null && warehouseId.isBlank()) {
            warehouseId = null;
        }
    }

    public static TransferScope all() {
        return new TransferScope(null, null, null);
    }

    public static TransferScope warehouse(String warehouseId) {
        return new TransferScope(null, null, warehouseId);
    }

    public static TransferScope of(LocalDate startDate, LocalDate endDate, String warehouseId) {
        return new TransferScope(startDate, endDate, warehouseId);
    }

    /**
     * Day after the end date, so timestamp columns on the last day still match.
     */
    public LocalDate endDateExclusive() {
        return endDate == null ? null : endDate.plusDays(1);
    }

    @Override
    public String toString() {
        return String.format("[%s..%s, warehouse=%s]",
                startDate == null ? "*" : startDate,
                endDate == null ? "*" : endDate,
                warehouseId == null ? "*" : warehouseId);
    }
}
