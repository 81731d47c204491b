package com.acme.export.core;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation signal threaded through every suspension point of a run
 * (admission, backoff, worker hand-off). Once cancelled it stays cancelled.
 */
public final class CancellationToken {
    private final CountDownLatch cancelled = new CountDownLatch(1);

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancelledException("Run cancelled");
        }
    }

    /**
     * Suspends the calling thread for the given time or until cancelled, whichever comes first.
     *
     * @return true if the full time elapsed, false if the token was cancelled
     */
    public boolean sleep(long nanos) {
        if (nanos <= 0) {
            return !isCancelled();
        }
        try {
            return !cancelled.await(nanos, TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            return false;
        }
    }

    public boolean sleep(Duration duration) {
        return sleep(duration.toNanos());
    }

    /** Cancels this token once the timeout elapses. */
    public CancellationToken cancelAfter(Duration timeout) {
        CompletableFuture.delayedExecutor(timeout.toMillis(), TimeUnit.MILLISECONDS).execute(this::cancel);
        return this;
    }
}
