package com.logistics.reconciliation.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.logistics.reconciliation.service.transfer.OrderPhase;
import com.logistics.reconciliation.service.transfer.TransferService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

@Component
@Command(name = "copy-orders-upsert", description = "Copy order headers and lines from Source to Target, updating rows already in Target")
public class CopyOrdersUpsertCommand extends TransferCommand {

    @Mixin
    ScopeOptions scope;

    @Option(names = "--phase", defaultValue = "ALL",
            description = "ALL, HEADERS or LINES (default: ${DEFAULT-VALUE})")
    OrderPhase phase;

    public CopyOrdersUpsertCommand(TransferService transferService, ObjectMapper objectMapper) {
        super(transferService, objectMapper);
    }

    @Override
    public Integer call() throws Exception {
        return report(transferService.copyOrdersUpsert(scope.toScope(), phase, options()));
    }
}
