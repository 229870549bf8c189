package com.logistics.reconciliation.controller;

import com.logistics.reconciliation.dto.BatchPayloadResult;
import com.logistics.reconciliation.dto.ComparisonResult;
import com.logistics.reconciliation.dto.DateRangeRequest;
import com.logistics.reconciliation.dto.ErrorResponse;
import com.logistics.reconciliation.dto.PayloadCreationResponse;
import com.logistics.reconciliation.dto.PayloadListResponse;
import com.logistics.reconciliation.dto.PayloadRangeRequest;
import com.logistics.reconciliation.dto.PayloadResultDetail;
import com.logistics.reconciliation.dto.ValidationReport;
import com.logistics.reconciliation.model.TransferScope;
import com.logistics.reconciliation.model.TransferTable;
import com.logistics.reconciliation.service.ComparisonService;
import com.logistics.reconciliation.service.PayloadService;
import com.logistics.reconciliation.service.ValidationService;
import com.logistics.reconciliation.service.transfer.CancellationRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.Map;

/**
 * REST API for comparison, payload and validation operations.
 * <p>
 * Bulk transfers are long-running and are started from the command line only.
 */
@RestController
@RequestMapping("/api/v1/reconciliation")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Reconciliation", description = "Order reconciliation and payload API")
public class ReconciliationController {

    private final ComparisonService comparisonService;
    private final PayloadService payloadService;
    private final ValidationService validationService;
    private final CancellationRegistry cancellationRegistry;

    @Operation(
            summary = "Compare order lines between Source and Target",
            description = "Counts order lines per do_number in Source and outbound items per outbound reference in Target for the given faktur date range and returns every do_number whose counts differ."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Comparison completed",
                    content = @Content(schema = @Schema(implementation = ComparisonResult.class))),
            @ApiResponse(responseCode = "400", description = "Missing dates or start date after end date",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "503", description = "A store stayed unavailable after retries")
    })
    @PostMapping("/compare")
    public ResponseEntity<ComparisonResult> compare(@RequestBody DateRangeRequest request) {
        log.info("Comparison requested via API for {} to {}", request.getStartDate(), request.getEndDate());
        return ResponseEntity.ok(comparisonService.compare(request.getStartDate(), request.getEndDate()));
    }

    @Operation(
            summary = "Create payload for one order",
            description = "Builds the JSON payload document for a do_number from the Target outbound tables and stores it in order_clean_payload with status CREATED."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Payload created",
                    content = @Content(schema = @Schema(implementation = PayloadCreationResponse.class))),
            @ApiResponse(responseCode = "404", description = "No outbound document for the do_number",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @PostMapping("/payloads/{doNumber}")
    public ResponseEntity<PayloadCreationResponse> createPayload(
            @Parameter(description = "Order do_number (outbound reference)") @PathVariable String doNumber) {
        log.info("Payload creation requested via API for do_number {}", doNumber);
        return ResponseEntity.ok(payloadService.create(doNumber));
    }

    @Operation(
            summary = "Create payloads for a date range",
            description = "Creates payloads for every Target order of one warehouse in the faktur date range. Orders without an outbound document are reported as missing."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Batch finished",
                    content = @Content(schema = @Schema(implementation = BatchPayloadResult.class))),
            @ApiResponse(responseCode = "400", description = "Missing range or warehouse")
    })
    @PostMapping("/payloads")
    public ResponseEntity<BatchPayloadResult> createPayloads(@RequestBody PayloadRangeRequest request) {
        log.info("Batch payload creation requested via API for {} to {}, warehouse {}",
                request.getStartDate(), request.getEndDate(), request.getWarehouseId());
        return ResponseEntity.ok(payloadService.createForRange(
                request.getStartDate(), request.getEndDate(), request.getWarehouseId()));
    }

    @Operation(
            summary = "List payload results",
            description = "Returns stored payload results ordered by id, without the payload documents."
    )
    @ApiResponse(responseCode = "200", description = "Payload results retrieved successfully",
            content = @Content(schema = @Schema(implementation = PayloadListResponse.class)))
    @GetMapping("/payloads")
    public ResponseEntity<PayloadListResponse> listPayloads(
            @Parameter(description = "Maximum number of results (1-1000)") @RequestParam(defaultValue = "100") int limit,
            @Parameter(description = "Number of results to skip") @RequestParam(defaultValue = "0") int offset) {
        return ResponseEntity.ok(payloadService.list(limit, offset));
    }

    @Operation(
            summary = "Get payload result by do_number",
            description = "Returns one stored payload result including its parsed payload document."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Payload result found",
                    content = @Content(schema = @Schema(implementation = PayloadResultDetail.class))),
            @ApiResponse(responseCode = "404", description = "Payload result not found")
    })
    @GetMapping("/payloads/{doNumber}")
    public ResponseEntity<PayloadResultDetail> getPayload(
            @Parameter(description = "Order do_number") @PathVariable String doNumber) {
        return ResponseEntity.ok(payloadService.get(doNumber));
    }

    @Operation(
            summary = "Validate a transferred table",
            description = "Counts rows of a table slice in Source and Target. A mismatch is reported, never corrected."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Counts compared",
                    content = @Content(schema = @Schema(implementation = ValidationReport.class))),
            @ApiResponse(responseCode = "400", description = "Unknown table or invalid range")
    })
    @PostMapping("/validate/{table}")
    public ResponseEntity<ValidationReport> validate(
            @Parameter(description = "products, orders or order-lines") @PathVariable String table,
            @Parameter(description = "First faktur date, inclusive")
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @Parameter(description = "Last faktur date, inclusive")
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @Parameter(description = "Warehouse filter")
            @RequestParam(name = "warehouse_id", required = false) String warehouseId) {
        TransferScope scope = TransferScope.of(startDate, endDate, warehouseId);
        return ResponseEntity.ok(validationService.validate(TransferTable.fromName(table), scope));
    }

    @Operation(
            summary = "Health check",
            description = "Returns the service status and the number of runs currently in progress."
    )
    @ApiResponse(responseCode = "200", description = "Service is healthy")
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> healthCheck() {
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "activeRuns", cancellationRegistry.activeCount()
        ));
    }
}
