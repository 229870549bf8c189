package com.logistics.reconciliation.model;

import java.math.BigDecimal;

/**
 * Line of a cleansed outbound document. {@code imageUrl} is the raw stored text,
 * usually a JSON array.
 */
public record OutboundItem(
        Long id,
        String outboundReference,
        String warehouseId,
        String lineId,
        String productId,
        String productDescription,
        String groupId,
        String groupDescription,
        String productType,
        BigDecimal qty,
        String uom,
        String packId,
        BigDecimal productNetPrice,
        String imageUrl
) {
}
