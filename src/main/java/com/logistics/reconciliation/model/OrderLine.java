package com.logistics.reconciliation.model;

import java.math.BigDecimal;

/**
 * One line item of an order.
 * <p>
 * The parent is identified by {@code fakturId}; {@code targetOrderId} is filled
 * in once the parent has been resolved in Target.
 */
public record OrderLine(
        Long sourceDetailId,
        String fakturId,
        Long targetOrderId,
        String productId,
        String unitId,
        String packId,
        String lineId,
        BigDecimal quantityFaktur,
        BigDecimal netPrice,
        BigDecimal quantityWms,
        BigDecimal quantityDelivery,
        BigDecimal quantityLoading,
        BigDecimal quantityUnloading,
        String status,
        Double unloadingLatitude,
        Double unloadingLongitude,
        String originUom,
        BigDecimal originQty,
        BigDecimal totalCtn,
        BigDecimal totalPcs
) implements TransferRecord {

    @Override
    public String cursorKey() {
        return String.valueOf(sourceDetailId);
    }

    @Override
    public String naturalKey() {
        return fakturId + "|" + productId + "|" + lineId;
    }

    public OrderLine withTargetOrderId(Long orderId) {
        return new OrderLine(sourceDetailId, fakturId, orderId, productId, unitId, packId, lineId,
                quantityFaktur, netPrice, quantityWms, quantityDelivery, quantityLoading, quantityUnloading,
                status, unloadingLatitude, unloadingLongitude, originUom, originQty, totalCtn, totalPcs);
    }
}
