package com.logistics.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Discrepancies for a date range, ordered by do_number.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComparisonResult {

    private String message;

    @JsonProperty("start_date")
    private LocalDate startDate;

    @JsonProperty("end_date")
    private LocalDate endDate;

    @JsonProperty("source_do_numbers")
    private int sourceDoNumbers;

    @JsonProperty("target_do_numbers")
    private int targetDoNumbers;

    @Builder.Default
    private List<Discrepancy> discrepancies = new ArrayList<>();

    @JsonProperty("total_discrepancies")
    public int getTotalDiscrepancies() {
        return discrepancies == null ? 0 : discrepancies.size();
    }
}
