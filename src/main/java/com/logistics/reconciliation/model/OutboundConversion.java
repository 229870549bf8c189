package com.logistics.reconciliation.model;

import java.math.BigDecimal;

public record OutboundConversion(Long id, Long itemId, String uom, BigDecimal numerator, BigDecimal denominator) {
}
