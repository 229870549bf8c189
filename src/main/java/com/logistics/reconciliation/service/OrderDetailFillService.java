package com.logistics.reconciliation.service;

import com.logistics.reconciliation.dto.FillResult;
import com.logistics.reconciliation.exception.TransferRunException;
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
import com.logistics.reconciliation.service.retry.RetryController;
import com.logistics.reconciliation.service.transfer.BatchWriter;
import com.logistics.reconciliation.service.transfer.CancellationRegistry;
import com.logistics.reconciliation.service.transfer.CancellationToken;
import com.logistics.reconciliation.service.transfer.TransferOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Back-fills {@code order_detail_main} for Target headers that have no lines,
 * using the outbound items of the same do_number.
 * <p>
 * Lines are written in {@link WriteMode#INSERT_IF_ABSENT} mode, so running the
 * fill twice never duplicates a line.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderDetailFillService {

    static final String PCS = "PCS";
    static final String CTN = "CTN";

    private final TargetOrderRepository orderRepository;
    private final TargetOrderLineRepository orderLineRepository;
    private final TargetOutboundRepository outboundRepository;
    private final BatchWriter batchWriter;
    private final RetryController retryController;
    private final CancellationRegistry cancellationRegistry;

    /**
     * Quantities derived for one back-filled line.
     */
    public record LineQuantities(BigDecimal quantityFaktur, BigDecimal totalPcs, BigDecimal totalCtn) {
    }

    public FillResult fill(LocalDate startDate, LocalDate endDate, String warehouseId, TransferOptions options) {
        if (startDate == null || endDate == null || warehouseId == null || warehouseId.isBlank()) {
            throw new IllegalArgumentException("start date, end date and warehouse id are required");
        }
        TransferScope scope = TransferScope.of(startDate, endDate, warehouseId);

        List<OrderRef> headers = retryController.execute("find headers without lines " + scope,
                options.retryPolicy(), () -> orderRepository.findWithoutLines(scope));
        log.info("Found {} order_main headers without lines in {}", headers.size(), scope);

        FillResult result = FillResult.builder()
                .scope(scope.toString())
                .headersWithoutLines(headers.size())
                .build();
        if (headers.isEmpty()) {
            return result;
        }

        CancellationToken token = cancellationRegistry.open("fill-order-details");
        long pageNumber = 0;
        try {
            for (int from = 0; from < headers.size(); from += options.batchSize()) {
                token.throwIfCancelled("filling headers from index " + from);
                List<OrderRef> chunk = headers.subList(from, Math.min(from + options.batchSize(), headers.size()));

                List<OrderLine> lines = buildLines(chunk, result, options, token);
                if (!lines.isEmpty()) {
                    pageNumber++;
                    PageRange range = new PageRange(pageNumber, chunk.get(0).doNumber(),
                            chunk.get(chunk.size() - 1).doNumber(), lines.size());
                    PageWriteResult written = retryController.execute("fill order_detail_main page " + range,
                            options.retryPolicy(), token,
                            () -> batchWriter.write(orderLineRepository, lines, WriteMode.INSERT_IF_ABSENT, range));
                    result.setInserted(result.getInserted() + written.inserted());
                    result.setSkipped(result.getSkipped() + written.skipped() + written.orphaned());
                    log.info("Filled page {}: {} lines inserted, {} skipped", range, written.inserted(),
                            written.skipped() + written.orphaned());
                }

                if (from + options.batchSize() < headers.size()) {
                    token.await(options.batchDelay());
                }
            }
        } catch (TransferRunException e) {
            log.error("fill-order-details halted after {} pages: {}", pageNumber, e.getMessage());
            throw e;
        } finally {
            cancellationRegistry.close(token);
        }

        log.info("Filled order lines for {}: {} inserted, {} skipped, {} headers without outbound items",
                scope, result.getInserted(), result.getSkipped(), result.getWithoutOutboundItems().size());
        return result;
    }

    private List<OrderLine> buildLines(List<OrderRef> headers, FillResult result, TransferOptions options,
                                       CancellationToken token) {
        List<String> doNumbers = headers.stream().map(OrderRef::doNumber).toList();
        Map<String, List<OutboundItem>> itemsByReference = retryController.execute(
                "find outbound items for " + doNumbers.size() + " orders", options.retryPolicy(), token,
                () -> outboundRepository.findItemsByReferences(doNumbers));

        List<Long> itemIds = itemsByReference.values().stream()
                .flatMap(List::stream)
                .map(OutboundItem::id)
                .toList();
        Map<Long, List<OutboundConversion>> conversions = retryController.execute(
                "find outbound conversions for " + itemIds.size() + " items", options.retryPolicy(), token,
                () -> outboundRepository.findConversions(itemIds));

        List<OrderLine> lines = new ArrayList<>();
        for (OrderRef header : headers) {
            List<OutboundItem> items = itemsByReference.getOrDefault(header.doNumber(), List.of());
            if (items.isEmpty()) {
                result.getWithoutOutboundItems().add(header.doNumber());
                continue;
            }
            for (OutboundItem item : items) {
                List<OutboundConversion> itemConversions = conversions.getOrDefault(item.id(), List.of());
                OutboundConversion first = itemConversions.isEmpty() ? null : itemConversions.get(0);
                lines.add(toLine(header, item, first));
            }
        }
        return lines;
    }

    static OrderLine toLine(OrderRef header, OutboundItem item, OutboundConversion conversion) {
        LineQuantities quantities = calculateQuantities(item.qty(), item.uom(),
                conversion == null ? null : conversion.numerator());

        return new OrderLine(
                item.id(),
                header.fakturId(),
                header.orderId(),
                item.productId(),
                null,
                item.packId(),
                item.lineId(),
                quantities.quantityFaktur(),
                item.productNetPrice(),
                null,
                null,
                null,
                null,
                null,
                null,
                null,
                item.uom(),
                item.qty(),
                quantities.totalCtn(),
                quantities.totalPcs());
    }

    /**
     * Non-PCS units with a conversion are expanded to pieces
     * ({@code qty * numerator}); otherwise the quantity is kept as is.
     * CTN lines also record the carton count.
     */
    public static LineQuantities calculateQuantities(BigDecimal qty, String uom, BigDecimal numerator) {
        BigDecimal quantityFaktur = qty;
        BigDecimal totalPcs = qty;
        BigDecimal totalCtn = null;

        if (uom != null && !PCS.equalsIgnoreCase(uom) && numerator != null && qty != null) {
            quantityFaktur = qty.multiply(numerator);
            totalPcs = quantityFaktur;
        }
        if (CTN.equalsIgnoreCase(uom)) {
            totalCtn = qty;
        }
        return new LineQuantities(quantityFaktur, totalPcs, totalCtn);
    }
}
