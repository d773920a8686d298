package com.smartpay.resilience.retry;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation signal shared between a caller and the work it
 * started. Waits performed through {@link #sleep(Duration)} return as soon as
 * the token is cancelled instead of running to completion.
 */
public final class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private volatile String reason;

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel() {
        cancel("cancelled");
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

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new OperationCancelledException("Operation cancelled: " + reason);
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new OperationCancelledException("Operation cancelled: thread interrupted");
        }
    }

    /**
     * Wait for {@code delay} unless cancelled first.
     *
     * @throws OperationCancelledException if the token fires or the thread is interrupted during the wait
     */
    public void sleep(Duration delay) {
        throwIfCancelled();
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            if (cancelled.await(delay.toNanos(), TimeUnit.NANOSECONDS)) {
                throw new OperationCancelledException("Operation cancelled during wait: " + reason);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("Operation cancelled: thread interrupted", e);
        }
    }
}
