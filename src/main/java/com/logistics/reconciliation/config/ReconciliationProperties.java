package com.logistics.reconciliation.config;

import com.logistics.reconciliation.service.retry.RetryPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Process-wide settings, bound once at startup from {@code reconciliation.*}.
 * <p>
 * Components receive this object through their constructor instead of reading
 * individual properties, so every run sees the same values.
 */
@Data
@ConfigurationProperties(prefix = "reconciliation")
public class ReconciliationProperties {

    private StoreConnection source = new StoreConnection();

    private StoreConnection target = new StoreConnection();

    private Transfer transfer = new Transfer();

    private Retry retry = new Retry();

    private CircuitBreaker circuitBreaker = new CircuitBreaker();

    /**
     * Connection descriptor for one relational store.
     * When {@code url} is set it wins over host/port/database.
     */
    @Data
    public static class StoreConnection {
        private String host = "localhost";
        private int port = 5432;
        private String database;
        private String username;
        private String password;
        private String url;
        private String driverClassName;
        private int maximumPoolSize = 5;
        private Duration connectionTimeout = Duration.ofSeconds(30);
        private Duration queryTimeout = Duration.ofMinutes(5);

        public String jdbcUrl() {
            if (url != null && !url.isBlank()) {
                return url;
            }
            return String.format("jdbc:postgresql://%s:%d/%s", host, port, database);
        }
    }

    @Data
    public static class Transfer {
        /**
         * Rows per page read from Source and written to Target in one transaction.
         */
        private int batchSize = 1000;

        /**
         * Pause between committed pages to bound load on both stores.
         */
        private Duration batchDelay = Duration.ofSeconds(30);
    }

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialDelay = Duration.ofSeconds(2);
        private double multiplier = 2.0;
        private Duration maxDelay = Duration.ofSeconds(60);
        private RetryPolicy.Backoff backoff = RetryPolicy.Backoff.EXPONENTIAL;

        public RetryPolicy toPolicy() {
            return new RetryPolicy(maxAttempts, backoff, initialDelay, multiplier, maxDelay);
        }
    }

    @Data
    public static class CircuitBreaker {
        private int slidingWindowSize = 10;
        private float failureRateThreshold = 50;
        private Duration waitDurationInOpenState = Duration.ofSeconds(30);
        private int permittedNumberOfCallsInHalfOpenState = 3;
    }
}
