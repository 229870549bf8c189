package com.logistics.reconciliation.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.logistics.reconciliation.dto.ComparisonResult;
import com.logistics.reconciliation.dto.Discrepancy;
import com.logistics.reconciliation.exception.OrderNotFoundException;
import com.logistics.reconciliation.service.ComparisonService;
import com.logistics.reconciliation.service.PayloadService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.LocalDate;

@Component
@Slf4j
@Command(name = "compare-data",
        description = "Compare order line counts per do_number between Source and Target")
public class CompareDataCommand extends JsonOutputCommand {

    private final ComparisonService comparisonService;
    private final PayloadService payloadService;

    @Option(names = "--start-date", required = true, description = "First faktur date, inclusive (yyyy-MM-dd)")
    LocalDate startDate;

    @Option(names = "--end-date", required = true, description = "Last faktur date, inclusive (yyyy-MM-dd)")
    LocalDate endDate;

    @Option(names = "--create-payloads", description = "Create a payload for every do_number with a discrepancy")
    boolean createPayloads;

    public CompareDataCommand(ComparisonService comparisonService, PayloadService payloadService,
                              ObjectMapper objectMapper) {
        super(objectMapper);
        this.comparisonService = comparisonService;
        this.payloadService = payloadService;
    }

    @Override
    public Integer call() throws Exception {
        ComparisonResult result = comparisonService.compare(startDate, endDate);
        printJson(result);

        if (createPayloads && !result.getDiscrepancies().isEmpty()) {
            int created = 0;
            int missing = 0;
            for (Discrepancy discrepancy : result.getDiscrepancies()) {
                try {
                    payloadService.create(discrepancy);
                    created++;
                } catch (OrderNotFoundException e) {
                    log.warn("No outbound document for do_number {}, payload not created", discrepancy.getDoNumber());
                    missing++;
                }
            }
            out().printf("Payloads created: %d, missing outbound documents: %d%n", created, missing);
            out().flush();
        }
        return ExitCodes.OK;
    }
}
