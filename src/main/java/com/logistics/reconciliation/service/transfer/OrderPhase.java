package com.logistics.reconciliation.service.transfer;

/**
 * Which tables an order transfer covers. Headers always go before lines.
 */
public enum OrderPhase {
    ALL,
    HEADERS,
    LINES
}
