package com.logistics.reconciliation.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.logistics.reconciliation.config.ReconciliationProperties;
import com.logistics.reconciliation.dto.BatchPayloadResult;
import com.logistics.reconciliation.dto.Discrepancy;
import com.logistics.reconciliation.dto.PayloadCreationResponse;
import com.logistics.reconciliation.dto.PayloadListResponse;
import com.logistics.reconciliation.dto.PayloadResultDetail;
import com.logistics.reconciliation.entity.PayloadResult;
import com.logistics.reconciliation.entity.PayloadStatus;
import com.logistics.reconciliation.exception.OrderNotFoundException;
import com.logistics.reconciliation.exception.PayloadNotFoundException;
import com.logistics.reconciliation.model.Address;
import com.logistics.reconciliation.model.OutboundConversion;
import com.logistics.reconciliation.model.OutboundDocument;
import com.logistics.reconciliation.model.OutboundItem;
import com.logistics.reconciliation.model.TransferScope;
import com.logistics.reconciliation.repository.PayloadResultRepository;
import com.logistics.reconciliation.repository.target.TargetOrderRepository;
import com.logistics.reconciliation.repository.target.TargetOutboundRepository;
import com.logistics.reconciliation.service.retry.FailureClassifier;
import com.logistics.reconciliation.service.retry.RetryController;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for PayloadService.
 */
@ExtendWith(MockitoExtension.class)
class PayloadServiceTest {

    private static final String DO_NUMBER = "B01SI2507-1602";

    @Mock
    private TargetOutboundRepository outboundRepository;

    @Mock
    private TargetOrderRepository orderRepository;

    @Mock
    private PayloadResultRepository payloadResultRepository;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private SimpleMeterRegistry meterRegistry;
    private PayloadService payloadService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        RetryController retryController = new RetryController(new FailureClassifier(), meterRegistry);
        retryController.initMetrics();

        ReconciliationProperties properties = new ReconciliationProperties();
        properties.getRetry().setInitialDelay(Duration.ofMillis(1));

        payloadService = new PayloadService(outboundRepository, orderRepository, payloadResultRepository,
                new PayloadBuilder(objectMapper), retryController, properties, objectMapper, meterRegistry);
        payloadService.initMetrics();
    }

    @Nested
    @DisplayName("Creating payloads")
    class CreateTests {

        @Test
        @DisplayName("Should build and store a payload with status CREATED")
        void shouldCreatePayload() throws Exception {
            // Given
            OutboundDocument document = document(DO_NUMBER);
            OutboundItem item = item(10L);
            when(outboundRepository.findDocument(DO_NUMBER)).thenReturn(Optional.of(document));
            when(outboundRepository.findItems(document)).thenReturn(List.of(item));
            when(outboundRepository.findConversions(anyCollection())).thenReturn(Map.of(10L,
                    List.of(new OutboundConversion(1L, 10L, "CTN", new BigDecimal("96"), BigDecimal.ONE))));
            when(payloadResultRepository.findByDoNumber(DO_NUMBER)).thenReturn(Optional.empty());
            when(payloadResultRepository.save(any(PayloadResult.class))).thenAnswer(inv -> inv.getArgument(0));

            // When
            PayloadCreationResponse response = payloadService.create(DO_NUMBER);

            // Then
            assertThat(response.getMessage()).isEqualTo("Payload created successfully for do_number: " + DO_NUMBER);
            assertThat(response.getStatus()).isEqualTo(PayloadStatus.CREATED);
            assertThat(response.getPayloadData().getItems()).hasSize(1);

            ArgumentCaptor<PayloadResult> captor = ArgumentCaptor.forClass(PayloadResult.class);
            verify(payloadResultRepository).save(captor.capture());
            PayloadResult saved = captor.getValue();
            assertThat(saved.getDoNumber()).isEqualTo(DO_NUMBER);
            assertThat(saved.getWarehouseId()).isEqualTo("B01");
            assertThat(saved.getItemCount()).isEqualTo(1);
            assertThat(saved.getSourceCount()).isNull();
            assertThat(saved.getDiscrepancyCount()).isNull();
            assertThat(objectMapper.readTree(saved.getPayloadData()).get("outbound_reference").asText())
                    .isEqualTo(DO_NUMBER);
            assertThat(meterRegistry.counter("reconciliation.payload.created").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should replace an existing payload for the same do_number")
        void shouldReplaceExistingPayload() {
            LocalDateTime firstCreated = LocalDateTime.of(2025, 7, 1, 8, 0);
            OutboundDocument document = document(DO_NUMBER);
            PayloadResult existing = PayloadResult.builder()
                    .id(7L)
                    .doNumber(DO_NUMBER)
                    .payloadData("{}")
                    .status(PayloadStatus.FAILED)
                    .notes("previous failure")
                    .sourceCount(5L)
                    .createdAt(firstCreated)
                    .build();
            when(outboundRepository.findDocument(DO_NUMBER)).thenReturn(Optional.of(document));
            when(outboundRepository.findItems(document)).thenReturn(List.of());
            when(outboundRepository.findConversions(anyCollection())).thenReturn(Map.of());
            when(payloadResultRepository.findByDoNumber(DO_NUMBER)).thenReturn(Optional.of(existing));
            when(payloadResultRepository.save(any(PayloadResult.class))).thenAnswer(inv -> inv.getArgument(0));

            payloadService.create(DO_NUMBER);

            assertThat(existing.getId()).isEqualTo(7L);
            assertThat(existing.getStatus()).isEqualTo(PayloadStatus.CREATED);
            assertThat(existing.getNotes()).isNull();
            assertThat(existing.getItemCount()).isZero();
            assertThat(existing.getCreatedAt()).isAfter(firstCreated);
            assertThat(existing.getSourceCount()).isNull();
        }

        @Test
        @DisplayName("Should keep the comparison counts of a discrepancy")
        void shouldStoreDiscrepancyCounts() {
            // Given
            OutboundDocument document = document(DO_NUMBER);
            when(outboundRepository.findDocument(DO_NUMBER)).thenReturn(Optional.of(document));
            when(outboundRepository.findItems(document)).thenReturn(List.of(item(10L)));
            when(outboundRepository.findConversions(anyCollection())).thenReturn(Map.of());
            when(payloadResultRepository.findByDoNumber(DO_NUMBER)).thenReturn(Optional.empty());
            when(payloadResultRepository.save(any(PayloadResult.class))).thenAnswer(inv -> inv.getArgument(0));
            Discrepancy discrepancy = Discrepancy.builder()
                    .doNumber(DO_NUMBER).sourceCount(8).targetCount(3).delta(-5).build();

            // When
            payloadService.create(discrepancy);

            // Then
            ArgumentCaptor<PayloadResult> captor = ArgumentCaptor.forClass(PayloadResult.class);
            verify(payloadResultRepository).save(captor.capture());
            assertThat(captor.getValue().getSourceCount()).isEqualTo(8L);
            assertThat(captor.getValue().getTargetCount()).isEqualTo(3L);
            assertThat(captor.getValue().getDiscrepancyCount()).isEqualTo(5L);
        }

        @Test
        @DisplayName("Should throw OrderNotFoundException for an unknown do_number")
        void shouldThrowForUnknownDoNumber() {
            // Given
            when(outboundRepository.findDocument("UNKNOWN-ID")).thenReturn(Optional.empty());

            // When / Then
            assertThatThrownBy(() -> payloadService.create("UNKNOWN-ID"))
                    .isInstanceOf(OrderNotFoundException.class)
                    .hasMessageContaining("UNKNOWN-ID");
            verify(payloadResultRepository, never()).save(any());
            assertThat(meterRegistry.counter("reconciliation.payload.missing").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should reject a blank do_number")
        void shouldRejectBlankDoNumber() {
            assertThatThrownBy(() -> payloadService.create(" "))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Creating payloads for a range")
    class RangeTests {

        @Test
        @DisplayName("Should report do_numbers without an outbound document as missing")
        void shouldSplitCreatedAndMissing() {
            // Given
            LocalDate start = LocalDate.of(2025, 7, 1);
            LocalDate end = LocalDate.of(2025, 7, 31);
            when(orderRepository.findDoNumbers(TransferScope.of(start, end, "B01")))
                    .thenReturn(List.of("DO-1", "DO-2"));
            OutboundDocument document = document("DO-1");
            when(outboundRepository.findDocument("DO-1")).thenReturn(Optional.of(document));
            when(outboundRepository.findDocument("DO-2")).thenReturn(Optional.empty());
            when(outboundRepository.findItems(document)).thenReturn(List.of());
            when(outboundRepository.findConversions(anyCollection())).thenReturn(Map.of());
            when(payloadResultRepository.findByDoNumber("DO-1")).thenReturn(Optional.empty());
            when(payloadResultRepository.save(any(PayloadResult.class))).thenAnswer(inv -> inv.getArgument(0));

            // When
            BatchPayloadResult result = payloadService.createForRange(start, end, "B01");

            // Then
            assertThat(result.getCreated()).containsExactly("DO-1");
            assertThat(result.getMissing()).containsExactly("DO-2");
            assertThat(result.getTotalOrders()).isEqualTo(2);
            assertThat(result.getCompletedAt()).isNotNull();
        }

        @Test
        @DisplayName("Should require a warehouse")
        void shouldRequireWarehouse() {
            assertThatThrownBy(() -> payloadService.createForRange(LocalDate.now(), LocalDate.now(), null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Reading payloads")
    class ReadTests {

        @Test
        @DisplayName("Should list a window of stored payloads")
        void shouldListPayloads() {
            PayloadResult stored = PayloadResult.builder()
                    .id(1L)
                    .doNumber(DO_NUMBER)
                    .payloadData("{}")
                    .status(PayloadStatus.CREATED)
                    .itemCount(3)
                    .build();
            when(payloadResultRepository.findSlice(10, 0)).thenReturn(List.of(stored));
            when(payloadResultRepository.count()).thenReturn(1L);

            PayloadListResponse response = payloadService.list(10, 0);

            assertThat(response.getMessage()).isEqualTo("Retrieved 1 payload results");
            assertThat(response.getTotal()).isEqualTo(1L);
            assertThat(response.getResults()).hasSize(1);
        }

        @Test
        @DisplayName("Should reject an out-of-range limit or a negative offset")
        void shouldValidatePaging() {
            assertThatThrownBy(() -> payloadService.list(0, 0)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> payloadService.list(1001, 0)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> payloadService.list(10, -1)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should return the stored payload document")
        void shouldGetPayload() {
            PayloadResult stored = PayloadResult.builder()
                    .id(1L)
                    .doNumber(DO_NUMBER)
                    .warehouseId("B01")
                    .payloadData("{\"outbound_reference\":\"" + DO_NUMBER + "\",\"order_type\":\"REG\"}")
                    .status(PayloadStatus.CREATED)
                    .build();
            when(payloadResultRepository.findByDoNumber(DO_NUMBER)).thenReturn(Optional.of(stored));

            PayloadResultDetail detail = payloadService.get(DO_NUMBER);

            assertThat(detail.getWarehouseId()).isEqualTo("B01");
            assertThat(detail.getPayloadData().getOutboundReference()).isEqualTo(DO_NUMBER);
            assertThat(detail.getPayloadData().getOrderType()).isEqualTo("REG");
        }

        @Test
        @DisplayName("Should throw PayloadNotFoundException when nothing is stored")
        void shouldThrowWhenPayloadMissing() {
            when(payloadResultRepository.findByDoNumber("DO-X")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> payloadService.get("DO-X"))
                    .isInstanceOf(PayloadNotFoundException.class);
        }
    }

    private static OutboundDocument document(String doNumber) {
        return new OutboundDocument(1L, "B01", "CLIENT-7", doNumber, "FOOD", LocalDate.of(2025, 7, 16), null,
                Address.empty(), "CUST-9", Address.empty(), null);
    }

    private static OutboundItem item(Long id) {
        return new OutboundItem(id, DO_NUMBER, "B01", "1", "P-1", "Product", "G1", "Group", "FG",
                new BigDecimal("3"), "CTN", "PK-1", new BigDecimal("15000"), null);
    }
}
