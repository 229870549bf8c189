package com.logistics.reconciliation.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.logistics.reconciliation.service.transfer.TransferService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

@Component
@Command(name = "copy-products-upsert", description = "Copy products from Source to Target, updating rows already in Target")
public class CopyProductsUpsertCommand extends TransferCommand {

    @Option(names = "--warehouse-id", description = "Only products of this warehouse")
    String warehouseId;

    public CopyProductsUpsertCommand(TransferService transferService, ObjectMapper objectMapper) {
        super(transferService, objectMapper);
    }

    @Override
    public Integer call() throws Exception {
        return report(List.of(transferService.copyProductsUpsert(warehouseId, options())));
    }
}
