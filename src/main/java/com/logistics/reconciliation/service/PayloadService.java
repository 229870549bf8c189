package com.logistics.reconciliation.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logistics.reconciliation.config.ReconciliationProperties;
import com.logistics.reconciliation.dto.BatchPayloadResult;
import com.logistics.reconciliation.dto.Discrepancy;
import com.logistics.reconciliation.dto.OrderPayload;
import com.logistics.reconciliation.dto.PayloadCreationResponse;
import com.logistics.reconciliation.dto.PayloadListResponse;
import com.logistics.reconciliation.dto.PayloadResultDetail;
import com.logistics.reconciliation.dto.PayloadResultSummary;
import com.logistics.reconciliation.entity.PayloadResult;
import com.logistics.reconciliation.entity.PayloadStatus;
import com.logistics.reconciliation.exception.OrderNotFoundException;
import com.logistics.reconciliation.exception.PayloadNotFoundException;
import com.logistics.reconciliation.exception.ReconciliationException;
import com.logistics.reconciliation.model.OutboundConversion;
import com.logistics.reconciliation.model.OutboundDocument;
import com.logistics.reconciliation.model.OutboundItem;
import com.logistics.reconciliation.model.TransferScope;
import com.logistics.reconciliation.repository.PayloadResultRepository;
import com.logistics.reconciliation.repository.target.TargetOrderRepository;
import com.logistics.reconciliation.repository.target.TargetOutboundRepository;
import com.logistics.reconciliation.service.retry.RetryController;
import com.logistics.reconciliation.service.retry.RetryPolicy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Builds, stores and serves order payloads. Reads only the Target store.
 * <p>
 * A payload created for a comparison discrepancy also records that
 * comparison's line counts.
 */
@Service
@Slf4j
public class PayloadService {

    static final int MAX_PAGE_SIZE = 1000;

    private final TargetOutboundRepository outboundRepository;
    private final TargetOrderRepository orderRepository;
    private final PayloadResultRepository payloadResultRepository;
    private final PayloadBuilder payloadBuilder;
    private final RetryController retryController;
    private final ReconciliationProperties properties;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    private Counter createdCounter;
    private Counter missingCounter;

    public PayloadService(TargetOutboundRepository outboundRepository,
                          TargetOrderRepository orderRepository,
                          PayloadResultRepository payloadResultRepository,
                          PayloadBuilder payloadBuilder,
                          RetryController retryController,
                          ReconciliationProperties properties,
                          ObjectMapper objectMapper,
                          MeterRegistry meterRegistry) {
        this.outboundRepository = outboundRepository;
        this.orderRepository = orderRepository;
        this.payloadResultRepository = payloadResultRepository;
        this.payloadBuilder = payloadBuilder;
        this.retryController = retryController;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        createdCounter = Counter.builder("reconciliation.payload.created")
                .description("Payloads built and stored")
                .register(meterRegistry);

        missingCounter = Counter.builder("reconciliation.payload.missing")
                .description("Payload requests for do_numbers without an outbound document")
                .register(meterRegistry);
    }

    /**
     * Builds the payload for one do_number and stores it, replacing any earlier
     * payload for the same do_number.
     *
     * @throws OrderNotFoundException if Target has no outbound document for the do_number
     */
    public PayloadCreationResponse create(String doNumber) {
        return create(doNumber, null);
    }

    /**
     * Builds and stores the payload for a discrepancy's do_number, keeping the
     * Source and Target line counts the comparison saw.
     *
     * @throws OrderNotFoundException if Target has no outbound document for the do_number
     */
    public PayloadCreationResponse create(Discrepancy discrepancy) {
        return create(discrepancy.getDoNumber(), discrepancy);
    }

    private PayloadCreationResponse create(String doNumber, Discrepancy discrepancy) {
        if (doNumber == null || doNumber.isBlank()) {
            throw new IllegalArgumentException("do_number is required");
        }
        RetryPolicy policy = properties.getRetry().toPolicy();

        OutboundDocument document = retryController.execute("find outbound document " + doNumber, policy,
                        () -> outboundRepository.findDocument(doNumber))
                .orElseThrow(() -> {
                    missingCounter.increment();
                    return new OrderNotFoundException(doNumber);
                });
        List<OutboundItem> items = retryController.execute("find outbound items " + doNumber, policy,
                () -> outboundRepository.findItems(document));
        Map<Long, List<OutboundConversion>> conversions = retryController.execute(
                "find outbound conversions " + doNumber, policy,
                () -> outboundRepository.findConversions(items.stream().map(OutboundItem::id).toList()));

        OrderPayload payload = payloadBuilder.build(document, items, conversions);
        String json = toJson(doNumber, payload);

        PayloadResult saved = retryController.execute("store payload " + doNumber, policy,
                () -> store(doNumber, document, items.size(), discrepancy, json));
        createdCounter.increment();
        log.info("Stored payload for do_number {} with {} items", doNumber, items.size());

        return PayloadCreationResponse.builder()
                .message("Payload created successfully for do_number: " + doNumber)
                .doNumber(doNumber)
                .payloadData(payload)
                .status(saved.getStatus())
                .build();
    }

    /**
     * Builds a payload for every distinct do_number in order_main for the
     * date range and warehouse. Orders without an outbound document are
     * reported as missing.
     */
    public BatchPayloadResult createForRange(LocalDate startDate, LocalDate endDate, String warehouseId) {
        if (startDate == null || endDate == null || warehouseId == null || warehouseId.isBlank()) {
            throw new IllegalArgumentException("start_date, end_date and warehouse_id are required");
        }
        TransferScope scope = TransferScope.of(startDate, endDate, warehouseId);
        BatchPayloadResult result = BatchPayloadResult.builder()
                .scope(scope.toString())
                .startedAt(LocalDateTime.now())
                .build();

        List<String> doNumbers = retryController.execute("list do_numbers " + scope,
                properties.getRetry().toPolicy(), () -> orderRepository.findDoNumbers(scope));
        log.info("Creating payloads for {} orders in {}", doNumbers.size(), scope);

        for (String doNumber : doNumbers) {
            try {
                create(doNumber);
                result.getCreated().add(doNumber);
            } catch (OrderNotFoundException e) {
                log.warn("No outbound document for do_number {}, skipping", doNumber);
                result.getMissing().add(doNumber);
            }
        }

        result.setCompletedAt(LocalDateTime.now());
        log.info("Created {} payloads for {}; {} orders without outbound document",
                result.getCreated().size(), scope, result.getMissing().size());
        return result;
    }

    public PayloadListResponse list(int limit, int offset) {
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_PAGE_SIZE);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        List<PayloadResultSummary> results = payloadResultRepository.findSlice(limit, offset).stream()
                .map(PayloadResultSummary::from)
                .toList();
        return PayloadListResponse.builder()
                .message(String.format("Retrieved %d payload results", results.size()))
                .total(payloadResultRepository.count())
                .limit(limit)
                .offset(offset)
                .results(results)
                .build();
    }

    /**
     * @throws PayloadNotFoundException if no payload is stored for the do_number
     */
    public PayloadResultDetail get(String doNumber) {
        PayloadResult result = payloadResultRepository.findByDoNumber(doNumber)
                .orElseThrow(() -> new PayloadNotFoundException(doNumber));

        return PayloadResultDetail.builder()
                .id(result.getId())
                .doNumber(result.getDoNumber())
                .warehouseId(result.getWarehouseId())
                .clientId(result.getClientId())
                .fakturDate(result.getFakturDate())
                .payloadData(fromJson(doNumber, result.getPayloadData()))
                .status(result.getStatus())
                .itemCount(result.getItemCount())
                .sourceCount(result.getSourceCount())
                .targetCount(result.getTargetCount())
                .discrepancyCount(result.getDiscrepancyCount())
                .notes(result.getNotes())
                .createdAt(result.getCreatedAt())
                .updatedAt(result.getUpdatedAt())
                .processedAt(result.getProcessedAt())
                .build();
    }

    private PayloadResult store(String doNumber, OutboundDocument document, int itemCount, Discrepancy discrepancy,
                                String json) {
        PayloadResult result = payloadResultRepository.findByDoNumber(doNumber)
                .orElseGet(() -> PayloadResult.builder().doNumber(doNumber).build());

        result.setCreatedAt(LocalDateTime.now());
        result.setWarehouseId(document.warehouseId());
        result.setClientId(document.clientId());
        result.setFakturDate(document.fakturDate());
        result.setPayloadData(json);
        result.setItemCount(itemCount);
        result.setSourceCount(discrepancy == null ? null : discrepancy.getSourceCount());
        result.setTargetCount(discrepancy == null ? null : discrepancy.getTargetCount());
        result.setDiscrepancyCount(discrepancy == null ? null : Math.abs(discrepancy.getDelta()));
        result.setStatus(PayloadStatus.CREATED);
        result.setProcessedAt(null);
        result.setNotes(null);
        return payloadResultRepository.save(result);
    }

    private String toJson(String doNumber, OrderPayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new ReconciliationException("Failed to serialize payload for do_number " + doNumber, e);
        }
    }

    private OrderPayload fromJson(String doNumber, String json) {
        try {
            return objectMapper.readValue(json, OrderPayload.class);
        } catch (JsonProcessingException e) {
            throw new ReconciliationException("Stored payload for do_number " + doNumber + " is not valid JSON", e);
        }
    }
}
