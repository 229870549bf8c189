package com.logistics.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of back-filling order lines for headers that had none.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FillResult {

    private String scope;

    @JsonProperty("headers_without_lines")
    private int headersWithoutLines;

    @Builder.Default
    private long inserted = 0;

    @Builder.Default
    private long skipped = 0;

    /**
     * do_numbers without any outbound items to build lines from.
     */
    @Builder.Default
    @JsonProperty("without_outbound_items")
    private List<String> withoutOutboundItems = new ArrayList<>();
}
