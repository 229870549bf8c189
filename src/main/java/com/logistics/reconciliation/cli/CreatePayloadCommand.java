package com.logistics.reconciliation.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.logistics.reconciliation.dto.PayloadCreationResponse;
import com.logistics.reconciliation.service.PayloadService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;

@Component
@Command(name = "create-payload", description = "Build and store the payload document of one order")
public class CreatePayloadCommand extends JsonOutputCommand {

    private final PayloadService payloadService;

    @Parameters(index = "0", paramLabel = "DO_NUMBER", description = "Order do_number")
    String doNumber;

    @Option(names = {"-o", "--output"}, description = "Also write the payload document to this JSON file")
    Path output;

    public CreatePayloadCommand(PayloadService payloadService, ObjectMapper objectMapper) {
        super(objectMapper);
        this.payloadService = payloadService;
    }

    @Override
    public Integer call() throws Exception {
        PayloadCreationResponse response = payloadService.create(doNumber);
        if (output != null) {
            writeJson(output, response.getPayloadData());
        }
        printJson(response);
        return ExitCodes.OK;
    }
}
