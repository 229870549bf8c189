package com.logistics.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.logistics.reconciliation.entity.PayloadResult;
import com.logistics.reconciliation.entity.PayloadStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A stored payload without its document.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PayloadResultSummary {

    private Long id;

    @JsonProperty("do_number")
    private String doNumber;

    @JsonProperty("warehouse_id")
    private String warehouseId;

    @JsonProperty("client_id")
    private String clientId;

    @JsonProperty("faktur_date")
    private LocalDate fakturDate;

    private PayloadStatus status;

    @JsonProperty("item_count")
    private Integer itemCount;

    @JsonProperty("source_count")
    private Long sourceCount;

    @JsonProperty("target_count")
    private Long targetCount;

    @JsonProperty("discrepancy_count")
    private Long discrepancyCount;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    @JsonProperty("processed_at")
    private LocalDateTime processedAt;

    public static PayloadResultSummary from(PayloadResult result) {
        return PayloadResultSummary.builder()
                .id(result.getId())
                .doNumber(result.getDoNumber())
                .warehouseId(result.getWarehouseId())
                .clientId(result.getClientId())
                .fakturDate(result.getFakturDate())
                .status(result.getStatus())
                .itemCount(result.getItemCount())
                .sourceCount(result.getSourceCount())
                .targetCount(result.getTargetCount())
                .discrepancyCount(result.getDiscrepancyCount())
                .createdAt(result.getCreatedAt())
                .processedAt(result.getProcessedAt())
                .build();
    }
}
