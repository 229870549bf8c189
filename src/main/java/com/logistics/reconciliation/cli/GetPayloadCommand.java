package com.logistics.reconciliation.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.logistics.reconciliation.dto.PayloadResultDetail;
import com.logistics.reconciliation.service.PayloadService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;

@Component
@Command(name = "get-payload", description = "Show a stored payload result")
public class GetPayloadCommand extends JsonOutputCommand {

    private final PayloadService payloadService;

    @Parameters(index = "0", paramLabel = "DO_NUMBER", description = "Order do_number")
    String doNumber;

    @Option(names = {"-o", "--output"}, description = "Write the payload document to this JSON file instead")
    Path output;

    public GetPayloadCommand(PayloadService payloadService, ObjectMapper objectMapper) {
        super(objectMapper);
        this.payloadService = payloadService;
    }

    @Override
    public Integer call() throws Exception {
        PayloadResultDetail detail = payloadService.get(doNumber);
        if (output != null) {
            writeJson(output, detail.getPayloadData());
        } else {
            printJson(detail);
        }
        return ExitCodes.OK;
    }
}
