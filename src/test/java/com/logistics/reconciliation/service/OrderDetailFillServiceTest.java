package com.logistics.reconciliation.service;

import com.logistics.reconciliation.dto.FillResult;
import com.logistics.reconciliation.model.OrderLine;
import com.logistics.reconciliation.model.OrderRef;
import com.logistics.reconciliation.model.OutboundConversion;
import com.logistics.reconciliation.model.OutboundItem;
import com.logistics.reconciliation.model.PageRange;
import com.logistics.reconciliation.model.PageWriteResult;
import com.logistics.reconciliation.model.TransferScope;
import com.logistics.reconciliation.model.WriteMode;
import com.logistics.reconciliation.repository.target.TargetOrderLineRepository;
import com.logistics.reconciliation.repository.target.TargetOrderRepository;
import com.logistics.reconciliation.repository.target.TargetOutboundRepository;
import com.logistics.reconciliation.service.OrderDetailFillService.LineQuantities;
import com.logistics.reconciliation.service.retry.FailureClassifier;
import com.logistics.reconciliation.service.retry.RetryController;
import com.logistics.reconciliation.service.retry.RetryPolicy;
import com.logistics.reconciliation.service.transfer.BatchWriter;
import com.logistics.reconciliation.service.transfer.CancellationRegistry;
import com.logistics.reconciliation.service.transfer.TransferOptions;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OrderDetailFillServiceTest {

    private static final LocalDate START = LocalDate.of(2025, 7, 1);
    private static final LocalDate END = LocalDate.of(2025, 7, 31);
    private static final TransferScope SCOPE = TransferScope.of(START, END, "B01");

    @Mock
    private TargetOrderRepository orderRepository;

    @Mock
    private TargetOrderLineRepository orderLineRepository;

    @Mock
    private TargetOutboundRepository outboundRepository;

    @Mock
    private BatchWriter batchWriter;

    @Captor
    private ArgumentCaptor<List<OrderLine>> linesCaptor;

    private CancellationRegistry cancellationRegistry;
    private OrderDetailFillService fillService;
    private TransferOptions options;

    @BeforeEach
    void setUp() {
        RetryController retryController = new RetryController(new FailureClassifier(), new SimpleMeterRegistry());
        retryController.initMetrics();
        cancellationRegistry = new CancellationRegistry();
        fillService = new OrderDetailFillService(orderRepository, orderLineRepository, outboundRepository,
                batchWriter, retryController, cancellationRegistry);
        options = new TransferOptions(1000, Duration.ZERO, null, false, RetryPolicy.noRetry());
    }

    @Nested
    @DisplayName("Quantity rules")
    class QuantityTests {

        @Test
        @DisplayName("Should expand cartons to pieces with the conversion numerator")
        void shouldExpandCartons() {
            LineQuantities quantities = OrderDetailFillService.calculateQuantities(
                    new BigDecimal("2"), "CTN", new BigDecimal("96"));

            assertThat(quantities.quantityFaktur()).isEqualByComparingTo("192");
            assertThat(quantities.totalPcs()).isEqualByComparingTo("192");
            assertThat(quantities.totalCtn()).isEqualByComparingTo("2");
        }

        @Test
        @DisplayName("Should keep piece quantities unchanged")
        void shouldKeepPieces() {
            LineQuantities quantities = OrderDetailFillService.calculateQuantities(
                    new BigDecimal("5"), "pcs", new BigDecimal("12"));

            assertThat(quantities.quantityFaktur()).isEqualByComparingTo("5");
            assertThat(quantities.totalPcs()).isEqualByComparingTo("5");
            assertThat(quantities.totalCtn()).isNull();
        }

        @Test
        @DisplayName("Should keep the quantity when no conversion exists")
        void shouldKeepQuantityWithoutConversion() {
            LineQuantities quantities = OrderDetailFillService.calculateQuantities(
                    new BigDecimal("3"), "CTN", null);

            assertThat(quantities.quantityFaktur()).isEqualByComparingTo("3");
            assertThat(quantities.totalCtn()).isEqualByComparingTo("3");
        }

        @Test
        @DisplayName("Should expand other units without recording cartons")
        void shouldExpandOtherUnits() {
            LineQuantities quantities = OrderDetailFillService.calculateQuantities(
                    new BigDecimal("4"), "BOX", new BigDecimal("6"));

            assertThat(quantities.totalPcs()).isEqualByComparingTo("24");
            assertThat(quantities.totalCtn()).isNull();
        }
    }

    @Nested
    @DisplayName("Filling lines")
    class FillTests {

        @Test
        @DisplayName("Should build lines from outbound items and write them insert-if-absent")
        void shouldFillLines() {
            // Given
            OrderRef header = new OrderRef(42L, "FKT-1", "DO-1");
            OutboundItem item = new OutboundItem(10L, "DO-1", "B01", "1", "P-1", "Product", "G1", "Group", "FG",
                    new BigDecimal("2"), "CTN", "PK-1", new BigDecimal("15000"), null);
            when(orderRepository.findWithoutLines(SCOPE)).thenReturn(List.of(header));
            when(outboundRepository.findItemsByReferences(List.of("DO-1"))).thenReturn(Map.of("DO-1", List.of(item)));
            when(outboundRepository.findConversions(anyCollection())).thenReturn(Map.of(10L,
                    List.of(new OutboundConversion(1L, 10L, "CTN", new BigDecimal("96"), BigDecimal.ONE))));
            when(batchWriter.write(eq(orderLineRepository), linesCaptor.capture(), eq(WriteMode.INSERT_IF_ABSENT),
                    any(PageRange.class))).thenReturn(new PageWriteResult(1, 0, 0, 0));

            // When
            FillResult result = fillService.fill(START, END, "B01", options);

            // Then
            assertThat(result.getHeadersWithoutLines()).isEqualTo(1);
            assertThat(result.getInserted()).isEqualTo(1);
            assertThat(result.getSkipped()).isZero();
            assertThat(result.getWithoutOutboundItems()).isEmpty();

            OrderLine line = linesCaptor.getValue().get(0);
            assertThat(line.sourceDetailId()).isEqualTo(10L);
            assertThat(line.fakturId()).isEqualTo("FKT-1");
            assertThat(line.targetOrderId()).isEqualTo(42L);
            assertThat(line.quantityFaktur()).isEqualByComparingTo("192");
            assertThat(line.totalCtn()).isEqualByComparingTo("2");
            assertThat(line.originUom()).isEqualTo("CTN");
            assertThat(line.originQty()).isEqualByComparingTo("2");
            assertThat(line.netPrice()).isEqualByComparingTo("15000");
            assertThat(cancellationRegistry.activeCount()).isZero();
        }

        @Test
        @DisplayName("Should report headers without outbound items")
        void shouldReportHeadersWithoutItems() {
            when(orderRepository.findWithoutLines(SCOPE)).thenReturn(List.of(new OrderRef(1L, "FKT-9", "DO-9")));
            when(outboundRepository.findItemsByReferences(List.of("DO-9"))).thenReturn(Map.of());
            when(outboundRepository.findConversions(anyCollection())).thenReturn(Map.of());

            FillResult result = fillService.fill(START, END, "B01", options);

            assertThat(result.getWithoutOutboundItems()).containsExactly("DO-9");
            assertThat(result.getInserted()).isZero();
            verify(batchWriter, never()).write(any(), any(), any(), any());
        }

        @Test
        @DisplayName("Should count lines already present as skipped")
        void shouldCountSkippedLines() {
            OutboundItem item = new OutboundItem(11L, "DO-1", "B01", "1", "P-1", null, null, null, null,
                    BigDecimal.ONE, "PCS", null, null, null);
            when(orderRepository.findWithoutLines(SCOPE)).thenReturn(List.of(new OrderRef(1L, "FKT-1", "DO-1")));
            when(outboundRepository.findItemsByReferences(List.of("DO-1"))).thenReturn(Map.of("DO-1", List.of(item)));
            when(outboundRepository.findConversions(anyCollection())).thenReturn(Map.of());
            when(batchWriter.write(eq(orderLineRepository), any(), eq(WriteMode.INSERT_IF_ABSENT), any(PageRange.class)))
                    .thenReturn(new PageWriteResult(0, 0, 1, 0));

            FillResult result = fillService.fill(START, END, "B01", options);

            assertThat(result.getInserted()).isZero();
            assertThat(result.getSkipped()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should return early when every header has lines")
        void shouldReturnEarlyWithoutHeaders() {
            when(orderRepository.findWithoutLines(SCOPE)).thenReturn(List.of());

            FillResult result = fillService.fill(START, END, "B01", options);

            assertThat(result.getHeadersWithoutLines()).isZero();
            verifyNoInteractions(outboundRepository, batchWriter);
        }

        @Test
        @DisplayName("Should require dates and a warehouse")
        void shouldRequireArguments() {
            assertThatThrownBy(() -> fillService.fill(START, END, null, options))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> fillService.fill(null, END, "B01", options))
                    .isInstanceOf(IllegalArgumentException.class);
            verifyNoInteractions(orderRepository);
        }
    }
}
