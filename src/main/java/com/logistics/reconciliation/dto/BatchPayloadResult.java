package com.logistics.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of building payloads for every order of a date range and warehouse.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchPayloadResult {

    private String scope;

    @JsonProperty("started_at")
    private LocalDateTime startedAt;

    @JsonProperty("completed_at")
    private LocalDateTime completedAt;

    @Builder.Default
    private List<String> created = new ArrayList<>();

    /**
     * do_numbers with a header in order_main but no outbound document.
     */
    @Builder.Default
    private List<String> missing = new ArrayList<>();

    @JsonProperty("total_orders")
    public int getTotalOrders() {
        return created.size() + missing.size();
    }
}
