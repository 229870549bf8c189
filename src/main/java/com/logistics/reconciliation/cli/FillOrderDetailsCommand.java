package com.logistics.reconciliation.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.logistics.reconciliation.service.OrderDetailFillService;
import com.logistics.reconciliation.service.transfer.TransferOptions;
import com.logistics.reconciliation.service.transfer.TransferService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.time.Duration;

@Component
@Command(name = "fill-order-details",
        description = "Create order_detail_main lines from outbound items for headers that have none")
public class FillOrderDetailsCommand extends JsonOutputCommand {

    private final OrderDetailFillService fillService;
    private final TransferService transferService;

    @Mixin
    ScopeOptions scope;

    @Option(names = "--batch-size", description = "Headers per page (default: reconciliation.transfer.batch-size)")
    Integer batchSize;

    @Option(names = "--batch-delay", description = "Seconds to wait between pages (default: reconciliation.transfer.batch-delay)")
    Long batchDelaySeconds;

    public FillOrderDetailsCommand(OrderDetailFillService fillService, TransferService transferService,
                                   ObjectMapper objectMapper) {
        super(objectMapper);
        this.fillService = fillService;
        this.transferService = transferService;
    }

    @Override
    public Integer call() throws Exception {
        TransferOptions options = transferService.defaultOptions();
        if (batchSize != null) {
            options = options.withBatchSize(batchSize);
        }
        if (batchDelaySeconds != null) {
            options = options.withBatchDelay(Duration.ofSeconds(batchDelaySeconds));
        }
        printJson(fillService.fill(scope.getStartDate(), scope.getEndDate(), scope.getWarehouseId(), options));
        return ExitCodes.OK;
    }
}
