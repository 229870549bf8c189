package com.logistics.reconciliation.service.retry;

import com.logistics.reconciliation.exception.FatalTransferException;
import com.logistics.reconciliation.exception.RetryExhaustedException;
import com.logistics.reconciliation.exception.TransferCancelledException;
import com.logistics.reconciliation.service.transfer.CancellationToken;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.QueryTimeoutException;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for RetryController.
 * <p>
 * Uses a real FailureClassifier and millisecond delays.
 */
class RetryControllerTest {

    private static final RetryPolicy THREE_ATTEMPTS = RetryPolicy.fixed(3, Duration.ofMillis(1));

    private SimpleMeterRegistry meterRegistry;
    private RetryController retryController;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        retryController = new RetryController(new FailureClassifier(), meterRegistry);
        retryController.initMetrics();
    }

    @Nested
    @DisplayName("Transient failures")
    class TransientFailureTests {

        @Test
        @DisplayName("Should retry a transient failure and return the later result")
        void shouldRetryThenSucceed() {
            // Given
            AtomicInteger calls = new AtomicInteger();

            // When
            String result = retryController.execute("read page", THREE_ATTEMPTS, () -> {
                if (calls.incrementAndGet() < 3) {
                    throw new QueryTimeoutException("statement timeout");
                }
                return "page";
            });

            // Then
            assertThat(result).isEqualTo("page");
            assertThat(calls.get()).isEqualTo(3);
            assertThat(meterRegistry.counter("reconciliation.retry.attempts").count()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("Should give up after the allowed attempts")
        void shouldExhaustAttempts() {
            // Given
            AtomicInteger calls = new AtomicInteger();

            // When / Then
            assertThatThrownBy(() -> retryController.execute("write page", THREE_ATTEMPTS, () -> {
                calls.incrementAndGet();
                throw new QueryTimeoutException("statement timeout");
            }))
                    .isInstanceOf(RetryExhaustedException.class)
                    .hasMessageContaining("write page")
                    .hasMessageContaining("3 attempts")
                    .satisfies(e -> assertThat(((RetryExhaustedException) e).getAttempts()).isEqualTo(3));

            assertThat(calls.get()).isEqualTo(3);
            assertThat(meterRegistry.counter("reconciliation.retry.exhausted").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should grow the delay with exponential backoff")
        void shouldBackOffExponentially() {
            // Given
            RetryPolicy policy = RetryPolicy.exponential(3, Duration.ofMillis(20), 2.0, Duration.ofMillis(100));
            AtomicInteger calls = new AtomicInteger();
            long started = System.nanoTime();

            // When
            assertThatThrownBy(() -> retryController.execute("count rows", policy, () -> {
                calls.incrementAndGet();
                throw new QueryTimeoutException("timeout");
            })).isInstanceOf(RetryExhaustedException.class);

            // Then: 20ms + 40ms of backoff at least
            assertThat(Duration.ofNanos(System.nanoTime() - started)).isGreaterThanOrEqualTo(Duration.ofMillis(60));
            assertThat(calls.get()).isEqualTo(3);
        }
    }

    @Nested
    @DisplayName("Permanent failures")
    class PermanentFailureTests {

        @Test
        @DisplayName("Should not retry a permanent failure")
        void shouldNotRetryPermanentFailure() {
            // Given
            AtomicInteger calls = new AtomicInteger();

            // When / Then
            assertThatThrownBy(() -> retryController.execute("write page", THREE_ATTEMPTS, () -> {
                calls.incrementAndGet();
                throw new DataIntegrityViolationException("value too long for type character varying(50)");
            }))
                    .isInstanceOf(FatalTransferException.class)
                    .hasCauseInstanceOf(DataIntegrityViolationException.class);

            assertThat(calls.get()).isEqualTo(1);
            assertThat(meterRegistry.counter("reconciliation.retry.fatal").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should fail a unique-key violation on the first attempt")
        void shouldNotRetryDuplicateKey() {
            // Given
            AtomicInteger calls = new AtomicInteger();

            // When / Then
            assertThatThrownBy(() -> retryController.execute("write page", THREE_ATTEMPTS, () -> {
                calls.incrementAndGet();
                throw new DuplicateKeyException("duplicate key value violates unique constraint uq_mst_product_main_sku");
            }))
                    .isInstanceOf(FatalTransferException.class)
                    .hasCauseInstanceOf(DuplicateKeyException.class);

            assertThat(calls.get()).isEqualTo(1);
        }

        @Test
        @DisplayName("Single-attempt policy surfaces transient failures as exhausted")
        void noRetryPolicyExhaustsImmediately() {
            AtomicInteger calls = new AtomicInteger();

            assertThatThrownBy(() -> retryController.execute("read page", RetryPolicy.noRetry(), () -> {
                calls.incrementAndGet();
                throw new QueryTimeoutException("timeout");
            })).isInstanceOf(RetryExhaustedException.class);

            assertThat(calls.get()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class CancellationTests {

        @Test
        @DisplayName("Should not start an operation for a cancelled token")
        void shouldNotStartWhenCancelled() {
            // Given
            CancellationToken token = new CancellationToken("copy-products");
            token.cancel("operator request");
            AtomicInteger calls = new AtomicInteger();

            // When / Then
            assertThatThrownBy(() -> retryController.execute("read page", THREE_ATTEMPTS, token, () -> {
                calls.incrementAndGet();
                return "page";
            })).isInstanceOf(TransferCancelledException.class);

            assertThat(calls.get()).isZero();
        }

        @Test
        @DisplayName("Should stop backing off when the token is cancelled")
        void shouldStopBackingOffWhenCancelled() {
            // Given
            CancellationToken token = new CancellationToken("copy-products");
            RetryPolicy slow = RetryPolicy.fixed(5, Duration.ofSeconds(30));
            AtomicInteger calls = new AtomicInteger();
            long started = System.nanoTime();

            // When: the first failure cancels the run before the backoff starts
            assertThatThrownBy(() -> retryController.execute("read page", slow, token, () -> {
                calls.incrementAndGet();
                token.cancel("shutdown");
                throw new QueryTimeoutException("timeout");
            })).isInstanceOf(TransferCancelledException.class);

            // Then
            assertThat(calls.get()).isEqualTo(1);
            assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(5));
        }
    }
}
