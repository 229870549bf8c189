package com.logistics.reconciliation.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.logistics.reconciliation.service.PayloadService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Component
@Command(name = "list-payloads", description = "List stored payload results")
public class ListPayloadsCommand extends JsonOutputCommand {

    private final PayloadService payloadService;

    @Option(names = "--limit", defaultValue = "100", description = "Maximum number of results, 1-1000 (default: ${DEFAULT-VALUE})")
    int limit;

    @Option(names = "--offset", defaultValue = "0", description = "Results to skip (default: ${DEFAULT-VALUE})")
    int offset;

    public ListPayloadsCommand(PayloadService payloadService, ObjectMapper objectMapper) {
        super(objectMapper);
        this.payloadService = payloadService;
    }

    @Override
    public Integer call() throws Exception {
        printJson(payloadService.list(limit, offset));
        return ExitCodes.OK;
    }
}
