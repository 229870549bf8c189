package com.logistics.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Unit conversion of a payload item: {@code numerator} base units per {@code denominator} of {@code uom}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"uom", "numerator", "denominator"})
public class PayloadConversion {

    private String uom;

    private BigDecimal numerator;

    private BigDecimal denominator;
}
