package com.logistics.reconciliation.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PayloadListResponse {

    private String message;

    private long total;

    private int limit;

    private int offset;

    @Builder.Default
    private List<PayloadResultSummary> results = new ArrayList<>();
}
