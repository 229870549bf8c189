package com.logistics.reconciliation.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.logistics.reconciliation.dto.ComparisonResult;
import com.logistics.reconciliation.dto.Discrepancy;
import com.logistics.reconciliation.dto.TransferResult;
import com.logistics.reconciliation.dto.ValidationReport;
import com.logistics.reconciliation.exception.OrderNotFoundException;
import com.logistics.reconciliation.exception.RetryExhaustedException;
import com.logistics.reconciliation.model.TransferCursor;
import com.logistics.reconciliation.model.WriteMode;
import com.logistics.reconciliation.service.ComparisonService;
import com.logistics.reconciliation.service.PayloadService;
import com.logistics.reconciliation.service.ValidationService;
import com.logistics.reconciliation.service.transfer.TransferOptions;
import com.logistics.reconciliation.service.transfer.TransferService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Runs individual commands through picocli with mocked services.
 */
@ExtendWith(MockitoExtension.class)
class CommandsTest {

    private static final LocalDate START = LocalDate.of(2025, 7, 1);
    private static final LocalDate END = LocalDate.of(2025, 7, 31);

    @Mock
    private ComparisonService comparisonService;

    @Mock
    private PayloadService payloadService;

    @Mock
    private TransferService transferService;

    @Mock
    private ValidationService validationService;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
    }

    private CommandLine commandLine(Object command) {
        CommandLine commandLine = new CommandLine(command)
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setExitCodeExceptionMapper(ExitCodes::forException)
                .setExecutionExceptionHandler(CommandLineRunnerAdapter::handleExecutionException);
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine;
    }

    @Nested
    @DisplayName("compare-data")
    @MockitoSettings(strictness = Strictness.LENIENT)
    class CompareDataTests {

        @Test
        @DisplayName("Should print the comparison as JSON")
        void shouldPrintComparison() {
            // Given
            when(comparisonService.compare(START, END)).thenReturn(ComparisonResult.builder()
                    .message("Found 0 discrepancies between Source and Target")
                    .build());

            // When
            int exitCode = commandLine(new CompareDataCommand(comparisonService, payloadService, objectMapper))
                    .execute("--start-date", "2025-07-01", "--end-date", "2025-07-31");

            // Then
            assertThat(exitCode).isEqualTo(ExitCodes.OK);
            assertThat(out.toString()).contains("\"total_discrepancies\" : 0");
            verifyNoInteractions(payloadService);
        }

        @Test
        @DisplayName("Should create payloads for discrepancies and count missing documents")
        void shouldCreatePayloads() {
            Discrepancy first = Discrepancy.builder().doNumber("DO-1").sourceCount(1).targetCount(2).delta(1).build();
            Discrepancy second = Discrepancy.builder().doNumber("DO-2").sourceCount(3).targetCount(0).delta(-3).build();
            when(comparisonService.compare(START, END)).thenReturn(ComparisonResult.builder()
                    .discrepancies(List.of(first, second))
                    .build());
            when(payloadService.create(second)).thenThrow(new OrderNotFoundException("DO-2"));

            int exitCode = commandLine(new CompareDataCommand(comparisonService, payloadService, objectMapper))
                    .execute("--start-date", "2025-07-01", "--end-date", "2025-07-31", "--create-payloads");

            assertThat(exitCode).isEqualTo(ExitCodes.OK);
            assertThat(out.toString()).contains("Payloads created: 1, missing outbound documents: 1");
            verify(payloadService).create(first);
        }

        @Test
        @DisplayName("Should exit with a usage error when a date is missing")
        void shouldRequireDates() {
            int exitCode = commandLine(new CompareDataCommand(comparisonService, payloadService, objectMapper))
                    .execute("--start-date", "2025-07-01");

            assertThat(exitCode).isEqualTo(ExitCodes.USAGE);
            assertThat(err.toString()).contains("--end-date");
            verifyNoInteractions(comparisonService);
        }

        @Test
        @DisplayName("Should exit with a usage error for an inverted range")
        void shouldRejectInvertedRange() {
            when(comparisonService.compare(END, START)).thenThrow(new IllegalArgumentException("start after end"));

            int exitCode = commandLine(new CompareDataCommand(comparisonService, payloadService, objectMapper))
                    .execute("--start-date", "2025-07-31", "--end-date", "2025-07-01");

            assertThat(exitCode).isEqualTo(ExitCodes.USAGE);
            assertThat(err.toString()).contains("Error: start after end");
        }
    }

    @Nested
    @DisplayName("copy-products")
    class CopyProductsTests {

        @BeforeEach
        void defaults() {
            when(transferService.defaultOptions())
                    .thenReturn(new TransferOptions(1000, Duration.ofSeconds(30), null, false, null));
        }

        @Test
        @DisplayName("Should pass paging options through to the transfer")
        void shouldApplyBulkOptions() {
            // Given
            ArgumentCaptor<TransferOptions> captor = ArgumentCaptor.forClass(TransferOptions.class);
            when(transferService.copyProducts(eq("B01"), captor.capture())).thenReturn(TransferResult.builder()
                    .table("mst_product_main").mode(WriteMode.INSERT_IF_ABSENT).inserted(5).build());

            // When
            int exitCode = commandLine(new CopyProductsCommand(transferService, objectMapper)).execute(
                    "--warehouse-id", "B01", "--batch-size", "50", "--batch-delay", "0",
                    "--resume-after", "SKU-009", "--validate");

            // Then
            assertThat(exitCode).isEqualTo(ExitCodes.OK);
            TransferOptions options = captor.getValue();
            assertThat(options.batchSize()).isEqualTo(50);
            assertThat(options.batchDelay()).isEqualTo(Duration.ZERO);
            assertThat(options.resumeAfter()).isEqualTo("SKU-009");
            assertThat(options.validate()).isTrue();
        }

        @Test
        @DisplayName("Should keep configured defaults for unset options")
        void shouldKeepDefaults() {
            ArgumentCaptor<TransferOptions> captor = ArgumentCaptor.forClass(TransferOptions.class);
            when(transferService.copyProducts(eq(null), captor.capture()))
                    .thenReturn(TransferResult.builder().table("mst_product_main").build());

            commandLine(new CopyProductsCommand(transferService, objectMapper)).execute();

            assertThat(captor.getValue().batchSize()).isEqualTo(1000);
            assertThat(captor.getValue().batchDelay()).isEqualTo(Duration.ofSeconds(30));
            assertThat(captor.getValue().validate()).isFalse();
        }

        @Test
        @DisplayName("Should report a validation mismatch without failing")
        void shouldReportMismatch() {
            when(transferService.copyProducts(eq(null), any(TransferOptions.class))).thenReturn(TransferResult.builder()
                    .table("mst_product_main")
                    .validation(ValidationReport.builder().sourceCount(10).targetCount(8).build())
                    .build());

            int exitCode = commandLine(new CopyProductsCommand(transferService, objectMapper)).execute("--validate");

            assertThat(exitCode).isEqualTo(ExitCodes.OK);
            assertThat(out.toString()).contains("Validation mismatch on mst_product_main: source=10 target=8");
        }

        @Test
        @DisplayName("Should print the resume key when retries run out")
        void shouldPrintResumeKey() {
            RetryExhaustedException exhausted = new RetryExhaustedException("write mst_product_main page", 3,
                    new RuntimeException("connection reset"));
            exhausted.setCursor(new TransferCursor("mst_product_main", "SKU-002", 1, 2));
            when(transferService.copyProducts(eq(null), any(TransferOptions.class))).thenThrow(exhausted);

            int exitCode = commandLine(new CopyProductsCommand(transferService, objectMapper)).execute();

            assertThat(exitCode).isEqualTo(ExitCodes.RETRY_EXHAUSTED);
            assertThat(err.toString()).contains("Resume with: --resume-after=SKU-002");
        }
    }

    @Test
    @DisplayName("validate should reject an unknown table")
    void shouldRejectUnknownTable() {
        int exitCode = commandLine(new ValidateCommand(validationService, objectMapper)).execute("customers");

        assertThat(exitCode).isEqualTo(ExitCodes.USAGE);
        assertThat(err.toString()).contains("Unknown table 'customers'");
        verifyNoInteractions(validationService);
    }
}
