package com.logistics.reconciliation.service;

import com.logistics.reconciliation.config.ReconciliationProperties;
import com.logistics.reconciliation.dto.ValidationReport;
import com.logistics.reconciliation.model.TransferRecord;
import com.logistics.reconciliation.model.TransferScope;
import com.logistics.reconciliation.model.TransferTable;
import com.logistics.reconciliation.repository.RecordReader;
import com.logistics.reconciliation.repository.RecordWriter;
import com.logistics.reconciliation.repository.source.SourceOrderLineRepository;
import com.logistics.reconciliation.repository.source.SourceOrderRepository;
import com.logistics.reconciliation.repository.source.SourceProductRepository;
import com.logistics.reconciliation.repository.target.TargetOrderLineRepository;
import com.logistics.reconciliation.repository.target.TargetOrderRepository;
import com.logistics.reconciliation.repository.target.TargetProductRepository;
import com.logistics.reconciliation.service.retry.RetryController;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * Post-transfer row-count check between Source and Target for one slice.
 * Read-only; a mismatch is logged and reported, never thrown.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ValidationService {

    private final SourceProductRepository sourceProducts;
    private final SourceOrderRepository sourceOrders;
    private final SourceOrderLineRepository sourceOrderLines;
    private final TargetProductRepository targetProducts;
    private final TargetOrderRepository targetOrders;
    private final TargetOrderLineRepository targetOrderLines;
    private final RetryController retryController;
    private final ReconciliationProperties properties;

    public ValidationReport validate(TransferTable table, TransferScope scope) {
        return switch (table) {
            case PRODUCTS -> validate(sourceProducts, targetProducts, scope);
            case ORDERS -> validate(sourceOrders, targetOrders, scope);
            case ORDER_LINES -> validate(sourceOrderLines, targetOrderLines, scope);
        };
    }

    public <T extends TransferRecord> ValidationReport validate(RecordReader<T> reader, RecordWriter<T> writer,
                                                                TransferScope scope) {
        long sourceCount = retryController.execute("count " + reader.table(), properties.getRetry().toPolicy(),
                () -> reader.count(scope));
        long targetCount = retryController.execute("count " + writer.table(), properties.getRetry().toPolicy(),
                () -> writer.count(scope));

        ValidationReport report = ValidationReport.builder()
                .sourceTable(reader.table())
                .targetTable(writer.table())
                .scope(scope.toString())
                .sourceCount(sourceCount)
                .targetCount(targetCount)
                .checkedAt(LocalDateTime.now())
                .build();

        if (report.isMatched()) {
            log.info("Validation OK for {} -> {} {}: {} rows on both sides",
                    reader.table(), writer.table(), scope, sourceCount);
        } else {
            log.warn("ValidationMismatch for {} -> {} {}: source={}, target={}, difference={}",
                    reader.table(), writer.table(), scope, sourceCount, targetCount, report.getDifference());
        }
        return report;
    }
}
