package com.logistics.reconciliation.scheduler;

import com.logistics.reconciliation.dto.TransferResult;
import com.logistics.reconciliation.exception.RetryExhaustedException;
import com.logistics.reconciliation.service.transfer.TransferOptions;
import com.logistics.reconciliation.service.transfer.TransferService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProductSyncSchedulerTest {

    @Mock
    private TransferService transferService;

    private ProductSyncScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new ProductSyncScheduler(transferService);
    }

    private void stubDefaults() {
        when(transferService.defaultOptions())
                .thenReturn(new TransferOptions(1000, Duration.ZERO, null, false, null));
    }

    @Test
    @DisplayName("Should do nothing while disabled")
    void shouldSkipWhenDisabled() {
        scheduler.setSchedulerEnabled(false);

        scheduler.runScheduledProductSync();

        verifyNoInteractions(transferService);
    }

    @Test
    @DisplayName("Should upsert products of the configured warehouse")
    void shouldSyncConfiguredWarehouse() {
        // Given
        stubDefaults();
        scheduler.setSchedulerEnabled(true);
        scheduler.setWarehouseId("B01");
        when(transferService.copyProductsUpsert(eq("B01"), any(TransferOptions.class)))
                .thenReturn(TransferResult.builder().table("mst_product_main").updated(3).build());

        // When
        scheduler.runScheduledProductSync();

        // Then
        verify(transferService).copyProductsUpsert(eq("B01"), any(TransferOptions.class));
        assertThat(scheduler.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Should sync every warehouse when none is configured")
    void shouldSyncAllWarehouses() {
        stubDefaults();
        scheduler.setSchedulerEnabled(true);
        scheduler.setWarehouseId("");
        when(transferService.copyProductsUpsert(isNull(), any(TransferOptions.class)))
                .thenReturn(TransferResult.builder().build());

        scheduler.runScheduledProductSync();

        verify(transferService).copyProductsUpsert(isNull(), any(TransferOptions.class));
    }

    @Test
    @DisplayName("Should release the guard after a halted run")
    void shouldReleaseGuardAfterFailure() {
        stubDefaults();
        scheduler.setSchedulerEnabled(true);
        when(transferService.copyProductsUpsert(isNull(), any(TransferOptions.class)))
                .thenThrow(new RetryExhaustedException("read mst_product page", 3, new RuntimeException("down")));

        scheduler.runScheduledProductSync();

        assertThat(scheduler.isRunning()).isFalse();
    }
}
