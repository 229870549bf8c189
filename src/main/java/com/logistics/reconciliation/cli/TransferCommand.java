package com.logistics.reconciliation.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.logistics.reconciliation.dto.TransferResult;
import com.logistics.reconciliation.service.transfer.TransferOptions;
import com.logistics.reconciliation.service.transfer.TransferService;
import picocli.CommandLine.Mixin;

import java.util.List;

/**
 * Base for the bulk copy commands.
 */
public abstract class TransferCommand extends JsonOutputCommand {

    protected final TransferService transferService;

    @Mixin
    BulkOptions bulk;

    protected TransferCommand(TransferService transferService, ObjectMapper objectMapper) {
        super(objectMapper);
        this.transferService = transferService;
    }

    protected TransferOptions options() {
        return bulk.applyTo(transferService.defaultOptions());
    }

    protected Integer report(List<TransferResult> results) throws Exception {
        printJson(results);
        for (TransferResult result : results) {
            if (result.getValidation() != null && !result.getValidation().isMatched()) {
                out().printf("Validation mismatch on %s: source=%d target=%d%n", result.getTable(),
                        result.getValidation().getSourceCount(), result.getValidation().getTargetCount());
            }
        }
        out().flush();
        return ExitCodes.OK;
    }
}
