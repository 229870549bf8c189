package com.logistics.reconciliation.service.transfer;

import com.logistics.reconciliation.exception.TransferCancelledException;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation flag for one run.
 * <p>
 * The engine checks it between pages and waits on it for the inter-page delay
 * and retry backoff, so cancelling wakes a sleeping run immediately.
 */
public class CancellationToken {

    private final String runName;
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private volatile String reason;

    public CancellationToken(String runName) {
        this.runName = runName;
    }

    /**
     * A token nobody else holds; it is only cancelled by thread interruption.
     */
    public static CancellationToken none() {
        return new CancellationToken("unregistered");
    }

    public String getRunName() {
        return runName;
    }

    public void cancel(String reason) {
        if (this.reason == null) {
            this.reason = reason;
        }
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public String getReason() {
        return reason;
    }

    public void throwIfCancelled(String where) {
        if (isCancelled()) {
            throw new TransferCancelledException(String.format("Run '%s' cancelled before %s: %s", runName, where, reason));
        }
    }

    /**
     * Waits for the given delay unless the token is cancelled first.
     *
     * @throws TransferCancelledException if cancelled before or during the wait
     */
    public void await(Duration delay) {
        throwIfCancelled("waiting " + delay);
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            if (cancelled.await(delay.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new TransferCancelledException(String.format("Run '%s' cancelled while waiting: %s", runName, reason));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel("thread interrupted");
            throw new TransferCancelledException(String.format("Run '%s' interrupted while waiting", runName), e);
        }
    }
}
