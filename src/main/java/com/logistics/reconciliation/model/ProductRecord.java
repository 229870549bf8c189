package com.logistics.reconciliation.model;

import java.math.BigDecimal;

/**
 * Product master row. SKU is unique in Target.
 */
public record ProductRecord(
        String sku,
        BigDecimal height,
        BigDecimal width,
        BigDecimal length,
        String name,
        BigDecimal price,
        String typeProductId,
        BigDecimal qty,
        BigDecimal volume,
        BigDecimal weight,
        String baseUom,
        String packId,
        String warehouseId
) implements TransferRecord {

    @Override
    public String cursorKey() {
        return sku;
    }

    @Override
    public String naturalKey() {
        return sku;
    }
}
