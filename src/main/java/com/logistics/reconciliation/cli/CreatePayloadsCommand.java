package com.logistics.reconciliation.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.logistics.reconciliation.service.PayloadService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

@Component
@Command(name = "create-payloads",
        description = "Create payloads for every order of a warehouse in a faktur date range")
public class CreatePayloadsCommand extends JsonOutputCommand {

    private final PayloadService payloadService;

    @Mixin
    ScopeOptions scope;

    public CreatePayloadsCommand(PayloadService payloadService, ObjectMapper objectMapper) {
        super(objectMapper);
        this.payloadService = payloadService;
    }

    @Override
    public Integer call() throws Exception {
        printJson(payloadService.createForRange(scope.getStartDate(), scope.getEndDate(), scope.getWarehouseId()));
        return ExitCodes.OK;
    }
}
