package com.logistics.reconciliation.model;

import java.time.LocalDate;

/**
 * Cleansed outbound document in Target; {@code outboundReference} holds the do_number.
 */
public record OutboundDocument(
        Long id,
        String warehouseId,
        String clientId,
        String outboundReference,
        String divisi,
        LocalDate fakturDate,
        LocalDate requestDeliveryDate,
        Address origin,
        String destinationId,
        Address destination,
        String orderType
) {
}
