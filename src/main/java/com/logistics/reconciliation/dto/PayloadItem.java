package com.logistics.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"warehouse_id", "line_id", "product_id", "product_description", "group_id",
        "group_description", "product_type", "qty", "uom", "pack_id", "product_net_price",
        "conversion", "image_url"})
public class PayloadItem {

    @JsonProperty("warehouse_id")
    private String warehouseId;

    @JsonProperty("line_id")
    private String lineId;

    @JsonProperty("product_id")
    private String productId;

    @JsonProperty("product_description")
    private String productDescription;

    @JsonProperty("group_id")
    private String groupId;

    @JsonProperty("group_description")
    private String groupDescription;

    @JsonProperty("product_type")
    private String productType;

    private BigDecimal qty;

    private String uom;

    @JsonProperty("pack_id")
    private String packId;

    @JsonProperty("product_net_price")
    private BigDecimal productNetPrice;

    @Builder.Default
    private List<PayloadConversion> conversion = new ArrayList<>();

    @Builder.Default
    @JsonProperty("image_url")
    private List<String> imageUrl = new ArrayList<>();
}
