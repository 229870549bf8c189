package com.logistics.reconciliation.service;

import com.logistics.reconciliation.config.ReconciliationProperties;
import com.logistics.reconciliation.dto.ComparisonResult;
import com.logistics.reconciliation.dto.Discrepancy;
import com.logistics.reconciliation.model.OutboundCount;
import com.logistics.reconciliation.repository.source.SourceOrderLineRepository;
import com.logistics.reconciliation.repository.target.TargetOutboundRepository;
import com.logistics.reconciliation.service.retry.RetryController;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Finds orders whose line counts differ between Source and Target.
 * <p>
 * Source lines are counted per do_number of the order header; Target lines are
 * the outbound items counted per outbound_reference. Both sides are filtered on
 * the faktur date. A do_number seen on one side only counts as zero on the other.
 */
@Service
@Slf4j
public class ComparisonService {

    private final SourceOrderLineRepository sourceOrderLines;
    private final TargetOutboundRepository targetOutbound;
    private final RetryController retryController;
    private final ReconciliationProperties properties;
    private final MeterRegistry meterRegistry;

    private Counter comparisonCounter;
    private Counter discrepancyCounter;
    private Timer comparisonTimer;

    public ComparisonService(SourceOrderLineRepository sourceOrderLines,
                             TargetOutboundRepository targetOutbound,
                             RetryController retryController,
                             ReconciliationProperties properties,
                             MeterRegistry meterRegistry) {
        this.sourceOrderLines = sourceOrderLines;
        this.targetOutbound = targetOutbound;
        this.retryController = retryController;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        comparisonCounter = Counter.builder("reconciliation.compare.runs")
                .description("Date-range comparisons executed")
                .register(meterRegistry);

        discrepancyCounter = Counter.builder("reconciliation.compare.discrepancies")
                .description("Discrepancies reported by comparisons")
                .register(meterRegistry);

        comparisonTimer = Timer.builder("reconciliation.compare.duration")
                .description("Time taken to compare a date range")
                .register(meterRegistry);
    }

    /**
     * Compares line counts for orders with a faktur date in [startDate, endDate].
     *
     * @return discrepancies ordered by do_number; zero deltas are left out
     * @throws IllegalArgumentException if a date is missing or startDate is after endDate
     */
    public ComparisonResult compare(LocalDate startDate, LocalDate endDate) {
        if (startDate == null || endDate == null) {
            throw new IllegalArgumentException("Both start_date and end_date are required");
        }
        if (startDate.isAfter(endDate)) {
            throw new IllegalArgumentException("start_date " + startDate + " is after end_date " + endDate);
        }

        log.info("Comparing order lines between Source and Target for {} .. {}", startDate, endDate);
        comparisonCounter.increment();

        return comparisonTimer.record(() -> {
            Map<String, Long> sourceCounts = retryController.execute("count Source lines by do_number",
                    properties.getRetry().toPolicy(),
                    () -> sourceOrderLines.countByDoNumber(startDate, endDate));
            Map<String, OutboundCount> targetCounts = retryController.execute("count Target items by do_number",
                    properties.getRetry().toPolicy(),
                    () -> targetOutbound.countByReference(startDate, endDate));

            List<Discrepancy> discrepancies = diff(sourceCounts, targetCounts);
            discrepancyCounter.increment(discrepancies.size());

            log.info("Found {} discrepancies ({} do_numbers in Source, {} in Target)",
                    discrepancies.size(), sourceCounts.size(), targetCounts.size());

            return ComparisonResult.builder()
                    .message(String.format("Found %d discrepancies between Source and Target", discrepancies.size()))
                    .startDate(startDate)
                    .endDate(endDate)
                    .sourceDoNumbers(sourceCounts.size())
                    .targetDoNumbers(targetCounts.size())
                    .discrepancies(discrepancies)
                    .build();
        });
    }

    static List<Discrepancy> diff(Map<String, Long> sourceCounts, Map<String, OutboundCount> targetCounts) {
        TreeSet<String> doNumbers = new TreeSet<>(sourceCounts.keySet());
        doNumbers.addAll(targetCounts.keySet());

        List<Discrepancy> discrepancies = new ArrayList<>();
        for (String doNumber : doNumbers) {
            long sourceCount = sourceCounts.getOrDefault(doNumber, 0L);
            OutboundCount target = targetCounts.get(doNumber);
            long targetCount = target == null ? 0L : target.lineCount();

            long delta = targetCount - sourceCount;
            if (delta == 0) {
                continue;
            }
            discrepancies.add(Discrepancy.builder()
                    .doNumber(doNumber)
                    .sourceCount(sourceCount)
                    .targetCount(targetCount)
                    .delta(delta)
                    .warehouseId(target == null ? null : target.warehouseId())
                    .clientId(target == null ? null : target.clientId())
                    .build());
        }
        return discrepancies;
    }
}
