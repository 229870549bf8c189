package com.logistics.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.logistics.reconciliation.entity.PayloadStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A stored payload with its parsed document.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PayloadResultDetail {

    private Long id;

    @JsonProperty("do_number")
    private String doNumber;

    @JsonProperty("warehouse_id")
    private String warehouseId;

    @JsonProperty("client_id")
    private String clientId;

    @JsonProperty("faktur_date")
    private LocalDate fakturDate;

    @JsonProperty("payload_data")
    private OrderPayload payloadData;

    private PayloadStatus status;

    @JsonProperty("item_count")
    private Integer itemCount;

    private String notes;

    @JsonProperty("source_count")
    private Long sourceCount;

    @JsonProperty("target_count")
    private Long targetCount;

    @JsonProperty("discrepancy_count")
    private Long discrepancyCount;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    @JsonProperty("updated_at")
    private LocalDateTime updatedAt;

    @JsonProperty("processed_at")
    private LocalDateTime processedAt;
}
