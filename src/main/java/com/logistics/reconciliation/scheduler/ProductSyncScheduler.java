package com.logistics.reconciliation.scheduler;

import com.logistics.reconciliation.dto.TransferResult;
import com.logistics.reconciliation.exception.ReconciliationException;
import com.logistics.reconciliation.service.transfer.TransferService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Recurring product sync from Source to Target in MERGE mode.
 * <p>
 * Disabled by default. Uses fixedDelay, so the next run starts only after the
 * previous one has finished.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProductSyncScheduler {

    private final TransferService transferService;

    private final AtomicBoolean isRunning = new AtomicBoolean(false);

    @Value("${reconciliation.scheduler.product-sync.enabled:false}")
    private boolean schedulerEnabled;

    @Value("${reconciliation.scheduler.product-sync.warehouse-id:}")
    private String warehouseId;

    @Scheduled(fixedDelayString = "${reconciliation.scheduler.product-sync.interval:PT1H}",
            initialDelayString = "${reconciliation.scheduler.product-sync.initial-delay:PT1M}")
    public void runScheduledProductSync() {
        if (!schedulerEnabled) {
            log.debug("Product sync scheduler is disabled, skipping run");
            return;
        }
        if (!isRunning.compareAndSet(false, true)) {
            log.warn("Product sync already in progress, skipping run");
            return;
        }

        String warehouse = warehouseId == null || warehouseId.isBlank() ? null : warehouseId;
        log.info("Starting scheduled product sync at {} for warehouse {}", LocalDateTime.now(),
                warehouse == null ? "*" : warehouse);

        try {
            TransferResult result = transferService.copyProductsUpsert(warehouse, transferService.defaultOptions());
            log.info("Product sync completed in {}ms: {} read, {} inserted, {} updated, {} skipped",
                    result.getDurationMs(), result.getRowsRead(), result.getInserted(),
                    result.getUpdated(), result.getSkipped());
        } catch (ReconciliationException e) {
            log.warn("Product sync halted: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Scheduled product sync failed with unexpected error", e);
        } finally {
            isRunning.set(false);
        }
    }

    public boolean isRunning() {
        return isRunning.get();
    }

    void setSchedulerEnabled(boolean schedulerEnabled) {
        this.schedulerEnabled = schedulerEnabled;
    }

    void setWarehouseId(String warehouseId) {
        this.warehouseId = warehouseId;
    }
}
