package com.logistics.reconciliation.service.transfer;

import com.logistics.reconciliation.config.ReconciliationProperties;
import com.logistics.reconciliation.dto.TransferResult;
import com.logistics.reconciliation.model.TransferScope;
import com.logistics.reconciliation.model.WriteMode;
import com.logistics.reconciliation.repository.source.SourceOrderLineRepository;
import com.logistics.reconciliation.repository.source.SourceOrderRepository;
import com.logistics.reconciliation.repository.source.SourceProductRepository;
import com.logistics.reconciliation.repository.target.TargetOrderLineRepository;
import com.logistics.reconciliation.repository.target.TargetOrderRepository;
import com.logistics.reconciliation.repository.target.TargetProductRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Bulk transfers from Source to Target.
 * <p>
 * The plain copies insert missing rows only and are safe to re-run; the
 * upsert variants also update rows that already exist in Target.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransferService {

    private final TransferEngine transferEngine;
    private final SourceProductRepository sourceProducts;
    private final SourceOrderRepository sourceOrders;
    private final SourceOrderLineRepository sourceOrderLines;
    private final TargetProductRepository targetProducts;
    private final TargetOrderRepository targetOrders;
    private final TargetOrderLineRepository targetOrderLines;
    private final ReconciliationProperties properties;

    public TransferOptions defaultOptions() {
        return TransferOptions.defaults(properties);
    }

    public TransferResult copyProducts(String warehouseId, TransferOptions options) {
        return transferProducts(warehouseId, WriteMode.INSERT_IF_ABSENT, options);
    }

    public TransferResult copyProductsUpsert(String warehouseId, TransferOptions options) {
        return transferProducts(warehouseId, WriteMode.MERGE, options);
    }

    public List<TransferResult> copyOrders(TransferScope scope, OrderPhase phase, TransferOptions options) {
        return transferOrders(scope, phase, WriteMode.INSERT_IF_ABSENT, options);
    }

    public List<TransferResult> copyOrdersUpsert(TransferScope scope, OrderPhase phase, TransferOptions options) {
        return transferOrders(scope, phase, WriteMode.MERGE, options);
    }

    private TransferResult transferProducts(String warehouseId, WriteMode mode, TransferOptions options) {
        String name = mode == WriteMode.MERGE ? "copy-products-upsert" : "copy-products";
        return transferEngine.run(new TransferJob<>(name, sourceProducts, targetProducts, mode,
                TransferScope.warehouse(warehouseId), options));
    }

    /**
     * Headers first, then lines, so that every line finds its parent.
     * A resume key applies to the first phase that runs.
     */
    private List<TransferResult> transferOrders(TransferScope scope, OrderPhase phase, WriteMode mode,
                                                TransferOptions options) {
        String prefix = mode == WriteMode.MERGE ? "copy-orders-upsert" : "copy-orders";
        List<TransferResult> results = new ArrayList<>();
        TransferOptions phaseOptions = options;

        if (phase != OrderPhase.LINES) {
            results.add(transferEngine.run(new TransferJob<>(prefix + "/headers", sourceOrders, targetOrders,
                    mode, scope, phaseOptions)));
            phaseOptions = options.withResumeAfter(null);
        }
        if (phase != OrderPhase.HEADERS) {
            results.add(transferEngine.run(new TransferJob<>(prefix + "/lines", sourceOrderLines, targetOrderLines,
                    mode, scope, phaseOptions)));
        }
        log.info("{} finished for {}: {} phase(s)", prefix, scope, results.size());
        return results;
    }
}
