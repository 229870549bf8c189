package com.logistics.reconciliation.cli;

import com.logistics.reconciliation.model.TransferScope;
import picocli.CommandLine.Option;

import java.time.LocalDate;

/**
 * Faktur date range and warehouse filter.
 */
public class ScopeOptions {

    @Option(names = "--start-date", description = "First faktur date, inclusive (yyyy-MM-dd)")
    LocalDate startDate;

    @Option(names = "--end-date", description = "Last faktur date, inclusive (yyyy-MM-dd)")
    LocalDate endDate;

    @Option(names = "--warehouse-id", description = "Warehouse filter")
    String warehouseId;

    public TransferScope toScope() {
        return TransferScope.of(startDate, endDate, warehouseId);
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    public String getWarehouseId() {
        return warehouseId;
    }
}
