package com.acme.export.core;

import jakarta.inject.Singleton;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a unit of work over every pending item with bounded concurrency.
 * <p>
 * Each item loops through admission, one attempt and, on failure, the retry policy until it
 * succeeds, fails terminally or the run is cancelled. Items are independent: one item
 * exhausting its retries does not affect the others. After cancellation no new attempt is
 * admitted, but an attempt already executing runs to completion.
 */
@Singleton
public class WorkerPool {
    private static final Logger LOG = LoggerFactory.getLogger(WorkerPool.class);

    private final RateLimiter limiter;
    private final RetryPolicy retryPolicy;

    public WorkerPool(RateLimiter limiter, RetryPolicy retryPolicy) {
        this.limiter = limiter;
        this.retryPolicy = retryPolicy;
    }

    /**
     * One attempt at one item. Throwing classifies the failure via {@link Failures#classify}.
     */
    @FunctionalInterface
    public interface UnitOfWork {
        void execute(WorkItem item) throws Exception;
    }

    /**
     * @return one outcome per pending item, in pending order
     */
    public List<ItemOutcome> run(List<WorkItem> pending, UnitOfWork work, int concurrency,
                                 CancellationToken token, Consumer<ItemOutcome> listener) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1");
        }
        if (pending.isEmpty()) {
            return List.of();
        }
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(concurrency, pending.size()), workerThreads());
        try {
            List<Future<ItemOutcome>> futures = new ArrayList<>(pending.size());
            for (WorkItem item : pending) {
                futures.add(executor.submit(() -> process(item, work, token, listener)));
            }
            List<ItemOutcome> outcomes = new ArrayList<>(pending.size());
            boolean interrupted = false;
            for (int i = 0; i < futures.size(); i++) {
                while (true) {
                    try {
                        outcomes.add(futures.get(i).get());
                        break;
                    } catch (InterruptedException e) {
                        // keep waiting: in-flight attempts must finish, queued ones now see the cancellation
                        interrupted = true;
                        token.cancel();
                    } catch (ExecutionException e) {
                        outcomes.add(ItemOutcome.failed(pending.get(i), 0, FailureKind.PERMANENT, Failures.describe(e)));
                        break;
                    }
                }
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
            return outcomes;
        } finally {
            executor.shutdown();
        }
    }

    private ItemOutcome process(WorkItem item, UnitOfWork work, CancellationToken token, Consumer<ItemOutcome> listener) {
        ItemOutcome outcome = attemptUntilTerminal(new AttemptRecord(item), work, token);
        try {
            listener.accept(outcome);
        } catch (RuntimeException e) {
            LOG.warn("Outcome listener failed for item {}: {}", item, e.toString());
        }
        return outcome;
    }

    private ItemOutcome attemptUntilTerminal(AttemptRecord attempt, UnitOfWork work, CancellationToken token) {
        WorkItem item = attempt.item();
        while (true) {
            if (token.isCancelled()) {
                return ItemOutcome.cancelled(item, attempt.attempts());
            }
            try {
                limiter.admit(token);
            } catch (CancelledException e) {
                return ItemOutcome.cancelled(item, attempt.attempts());
            }
            attempt.begin();
            try {
                work.execute(item);
                return ItemOutcome.succeeded(item, attempt.attempts());
            } catch (Exception e) {
                FailureKind kind = Failures.classify(e);
                attempt.failed(kind, Failures.describe(e));
                if (kind == FailureKind.RATE_LIMITED) {
                    limiter.penalize();
                }
                RetryDecision decision = retryPolicy.decide(kind, attempt.attempts(), Failures.retryAfter(e));
                if (!decision.retry()) {
                    LOG.warn("Item {} failed after {} attempt(s) ({}): {}",
                            item, attempt.attempts(), attempt.lastFailure(), attempt.lastError());
                    return ItemOutcome.failed(item, attempt.attempts(), attempt.lastFailure(), attempt.lastError());
                }
                attempt.scheduleNext(decision.delay());
                LOG.debug("Item {} attempt {} failed ({}: {}), retrying at {}",
                        item, attempt.attempts(), attempt.lastFailure(), attempt.lastError(), attempt.nextEligibleAt());
                if (!token.sleep(decision.delay())) {
                    return ItemOutcome.cancelled(item, attempt.attempts());
                }
            }
        }
    }

    private static ThreadFactory workerThreads() {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "export-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
