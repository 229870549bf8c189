package com.logistics.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Order-line count difference for one do_number.
 * {@code delta} is Target minus Source and is never zero.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Discrepancy {

    @JsonProperty("do_number")
    private String doNumber;

    @JsonProperty("source_count")
    private long sourceCount;

    @JsonProperty("target_count")
    private long targetCount;

    private long delta;

    @JsonProperty("warehouse_id")
    private String warehouseId;

    @JsonProperty("client_id")
    private String clientId;
}
