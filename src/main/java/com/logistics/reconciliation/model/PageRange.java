package com.logistics.reconciliation.model;

/**
 * Position of one page inside a transfer run.
 */
public record PageRange(long pageNumber, String firstKey, String lastKey, int size) {

    @Override
    public String toString() {
        return String.format("#%d [%s..%s] (%d rows)", pageNumber, firstKey, lastKey, size);
    }
}
