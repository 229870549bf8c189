package com.logistics.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalized order document built from the Target outbound projection.
 * String fields are never null; dates are {@code yyyy-MM-dd} or empty.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"warehouse_id", "client_id", "outbound_reference", "divisi", "faktur_date",
        "request_delivery_date", "origin_name", "origin_address_1", "origin_address_2", "origin_city",
        "origin_phone", "origin_email", "destination_id", "destination_name", "destination_address_1",
        "destination_address_2", "destination_city", "destination_zip_code", "destination_phone",
        "destination_email", "order_type", "items"})
public class OrderPayload {

    @JsonProperty("warehouse_id")
    private String warehouseId;

    @JsonProperty("client_id")
    private String clientId;

    @JsonProperty("outbound_reference")
    private String outboundReference;

    private String divisi;

    @JsonProperty("faktur_date")
    private String fakturDate;

    @JsonProperty("request_delivery_date")
    private String requestDeliveryDate;

    @JsonProperty("origin_name")
    private String originName;

    @JsonProperty("origin_address_1")
    private String originAddress1;

    @JsonProperty("origin_address_2")
    private String originAddress2;

    @JsonProperty("origin_city")
    private String originCity;

    @JsonProperty("origin_phone")
    private String originPhone;

    @JsonProperty("origin_email")
    private String originEmail;

    @JsonProperty("destination_id")
    private String destinationId;

    @JsonProperty("destination_name")
    private String destinationName;

    @JsonProperty("destination_address_1")
    private String destinationAddress1;

    @JsonProperty("destination_address_2")
    private String destinationAddress2;

    @JsonProperty("destination_city")
    private String destinationCity;

    @JsonProperty("destination_zip_code")
    private String destinationZipCode;

    @JsonProperty("destination_phone")
    private String destinationPhone;

    @JsonProperty("destination_email")
    private String destinationEmail;

    @JsonProperty("order_type")
    private String orderType;

    @Builder.Default
    private List<PayloadItem> items = new ArrayList<>();
}
