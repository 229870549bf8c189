package com.logistics.reconciliation.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.logistics.reconciliation.model.TransferTable;
import com.logistics.reconciliation.service.ValidationService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

@Component
@Command(name = "validate", description = "Compare row counts of a table slice in Source and Target")
public class ValidateCommand extends JsonOutputCommand {

    private final ValidationService validationService;

    @Parameters(index = "0", paramLabel = "TABLE", description = "products, orders or order-lines")
    String table;

    @Mixin
    ScopeOptions scope;

    public ValidateCommand(ValidationService validationService, ObjectMapper objectMapper) {
        super(objectMapper);
        this.validationService = validationService;
    }

    @Override
    public Integer call() throws Exception {
        printJson(validationService.validate(TransferTable.fromName(table), scope.toScope()));
        return ExitCodes.OK;
    }
}
