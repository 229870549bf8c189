package com.logistics.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.logistics.reconciliation.entity.PayloadStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PayloadCreationResponse {

    private String message;

    @JsonProperty("do_number")
    private String doNumber;

    @JsonProperty("payload_data")
    private OrderPayload payloadData;

    private PayloadStatus status;
}
