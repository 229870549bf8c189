package com.logistics.reconciliation.service.retry;

import java.time.Duration;

/**
 * How often and how patiently a store operation is retried.
 *
 * @param maxAttempts  total attempts including the first one, at least 1
 * @param backoff      fixed or exponential spacing between attempts
 * @param initialDelay delay before the second attempt
 * @param multiplier   growth factor for exponential backoff
 * @param maxDelay     upper bound for any single delay
 */
public record RetryPolicy(
        int maxAttempts,
        Backoff backoff,
        Duration initialDelay,
        double multiplier,
        Duration maxDelay
) {

    public enum Backoff {
        FIXED,
        EXPONENTIAL
    }

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);
        }
        if (backoff == null) {
            backoff = Backoff.EXPONENTIAL;
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must be zero or positive");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0, was " + multiplier);
        }
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            maxDelay = initialDelay;
        }
    }

    public static RetryPolicy fixed(int maxAttempts, Duration delay) {
        return new RetryPolicy(maxAttempts, Backoff.FIXED, delay, 1.0, delay);
    }

    public static RetryPolicy exponential(int maxAttempts, Duration initialDelay, double multiplier, Duration maxDelay) {
        return new RetryPolicy(maxAttempts, Backoff.EXPONENTIAL, initialDelay, multiplier, maxDelay);
    }

    public static RetryPolicy noRetry() {
        return fixed(1, Duration.ZERO);
    }
}
