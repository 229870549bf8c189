package com.logistics.reconciliation.model;

/**
 * Number of outbound items for one do_number, with the owning document's ids.
 */
public record OutboundCount(long lineCount, String warehouseId, String clientId) {
}
