package com.logistics.reconciliation.service.retry;

import com.logistics.reconciliation.exception.FatalTransferException;
import com.logistics.reconciliation.exception.RetryExhaustedException;
import com.logistics.reconciliation.exception.TransferCancelledException;
import com.logistics.reconciliation.exception.TransferRunException;
import com.logistics.reconciliation.service.transfer.CancellationToken;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.FixedBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.policy.ExceptionClassifierRetryPolicy;
import org.springframework.retry.policy.NeverRetryPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a store operation under a {@link RetryPolicy}.
 * <p>
 * Transient failures are retried with backoff until the policy is exhausted,
 * then surface as {@link RetryExhaustedException}. Permanent failures surface
 * immediately as {@link FatalTransferException}. Backoff sleeps wait on the
 * run's {@link CancellationToken}, so a cancelled run never sleeps out its
 * full delay.
 */
@Component
@Slf4j
public class RetryController {

    private final FailureClassifier failureClassifier;
    private final MeterRegistry meterRegistry;

    private Counter retryCounter;
    private Counter exhaustedCounter;
    private Counter fatalCounter;

    public RetryController(FailureClassifier failureClassifier, MeterRegistry meterRegistry) {
        this.failureClassifier = failureClassifier;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        retryCounter = Counter.builder("reconciliation.retry.attempts")
                .description("Store operations retried after a transient failure")
                .register(meterRegistry);

        exhaustedCounter = Counter.builder("reconciliation.retry.exhausted")
                .description("Store operations that failed on every allowed attempt")
                .register(meterRegistry);

        fatalCounter = Counter.builder("reconciliation.retry.fatal")
                .description("Store operations that failed permanently")
                .register(meterRegistry);
    }

    public <T> T execute(String operationName, RetryPolicy policy, Callable<T> operation) {
        return execute(operationName, policy, CancellationToken.none(), operation);
    }

    public <T> T execute(String operationName, RetryPolicy policy, CancellationToken token, Callable<T> operation) {
        RetryTemplate template = buildTemplate(policy, token);
        AtomicInteger attempts = new AtomicInteger();

        try {
            return template.execute((RetryContext context) -> {
                token.throwIfCancelled(operationName);
                int attempt = attempts.incrementAndGet();
                if (attempt > 1) {
                    retryCounter.increment();
                    log.warn("Retrying '{}' (attempt {}/{}) after transient failure: {}",
                            operationName, attempt, policy.maxAttempts(),
                            describe(context.getLastThrowable()));
                }
                return operation.call();
            });
        } catch (TransferRunException e) {
            throw e;
        } catch (BackOffInterruptedException e) {
            throw new TransferCancelledException("Interrupted while backing off before retrying '" + operationName + "'", e);
        } catch (Exception e) {
            if (failureClassifier.isTransient(e)) {
                exhaustedCounter.increment();
                log.error("Operation '{}' exhausted {} attempts: {}", operationName, attempts.get(), describe(e));
                throw new RetryExhaustedException(operationName, attempts.get(), e);
            }
            fatalCounter.increment();
            log.error("Operation '{}' failed permanently on attempt {}: {}", operationName, attempts.get(), describe(e));
            throw new FatalTransferException(operationName, e);
        }
    }

    private RetryTemplate buildTemplate(RetryPolicy policy, CancellationToken token) {
        SimpleRetryPolicy transientPolicy = new SimpleRetryPolicy(policy.maxAttempts());
        NeverRetryPolicy permanentPolicy = new NeverRetryPolicy();

        ExceptionClassifierRetryPolicy retryPolicy = new ExceptionClassifierRetryPolicy();
        retryPolicy.setExceptionClassifier(failure ->
                failureClassifier.isTransient(failure) ? transientPolicy : permanentPolicy);

        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(retryPolicy);
        template.setBackOffPolicy(buildBackOff(policy, period -> token.await(Duration.ofMillis(period))));
        template.setThrowLastExceptionOnExhausted(true);
        return template;
    }

    private BackOffPolicy buildBackOff(RetryPolicy policy, Sleeper sleeper) {
        if (policy.backoff() == RetryPolicy.Backoff.FIXED) {
            FixedBackOffPolicy fixed = new FixedBackOffPolicy();
            fixed.setBackOffPeriod(policy.initialDelay().toMillis());
            fixed.setSleeper(sleeper);
            return fixed;
        }
        ExponentialBackOffPolicy exponential = new ExponentialBackOffPolicy();
        exponential.setInitialInterval(policy.initialDelay().toMillis());
        exponential.setMultiplier(policy.multiplier());
        exponential.setMaxInterval(policy.maxDelay().toMillis());
        exponential.setSleeper(sleeper);
        return exponential;
    }

    private static String describe(Throwable failure) {
        if (failure == null) {
            return "<none>";
        }
        return failure.getClass().getSimpleName() + ": " + failure.getMessage();
    }
}
