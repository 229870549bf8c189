package com.logistics.reconciliation.config;

import com.logistics.reconciliation.model.Store;
import com.logistics.reconciliation.repository.StoreGuard;
import com.logistics.reconciliation.service.retry.FailureClassifier;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the Resilience4j circuit breaker in front of Source reads.
 * <p>
 * Only transient failures (lost connections, timeouts) count towards the
 * failure rate. While the breaker is OPEN, reads fail fast with
 * {@code SourceUnavailableException} and the retry controller backs off.
 */
@Configuration
@Slf4j
public class ResilienceConfig {

    public static final String SOURCE_BREAKER = "source-store";

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(ReconciliationProperties properties,
                                                         FailureClassifier failureClassifier) {
        ReconciliationProperties.CircuitBreaker settings = properties.getCircuitBreaker();
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowSize(settings.getSlidingWindowSize())
                .failureRateThreshold(settings.getFailureRateThreshold())
                .waitDurationInOpenState(settings.getWaitDurationInOpenState())
                .permittedNumberOfCallsInHalfOpenState(settings.getPermittedNumberOfCallsInHalfOpenState())
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .recordException(failureClassifier::isTransient)
                .build();

        return CircuitBreakerRegistry.of(config);
    }

    @Bean
    public StoreGuard sourceStoreGuard(CircuitBreakerRegistry registry, FailureClassifier failureClassifier) {
        CircuitBreaker breaker = registry.circuitBreaker(SOURCE_BREAKER);
        breaker.getEventPublisher().onStateTransition(event ->
                log.warn("Source circuit breaker: {}", event.getStateTransition()));
        return new StoreGuard(Store.SOURCE, breaker, failureClassifier);
    }

    @Bean
    public StoreGuard targetStoreGuard(FailureClassifier failureClassifier) {
        return new StoreGuard(Store.TARGET, null, failureClassifier);
    }
}
