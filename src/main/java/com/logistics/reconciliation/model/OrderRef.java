package com.logistics.reconciliation.model;

/**
 * Identity of an order header already stored in Target.
 */
public record OrderRef(Long orderId, String fakturId, String doNumber) {
}
