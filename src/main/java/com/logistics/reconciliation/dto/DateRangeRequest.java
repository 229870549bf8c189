package com.logistics.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Inclusive date range, ISO dates ({@code yyyy-MM-dd}).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DateRangeRequest {

    @JsonProperty("start_date")
    private LocalDate startDate;

    @JsonProperty("end_date")
    private LocalDate endDate;
}
