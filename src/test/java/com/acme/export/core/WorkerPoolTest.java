package com.acme.export.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class WorkerPoolTest {

    private RateLimiter limiter;
    private RetryPolicy retryPolicy;
    private WorkerPool pool;
    private List<ItemOutcome> notified;

    @BeforeEach
    void setUp() {
        limiter = new TokenBucketRateLimiter(1000, 1_000_000.0);
        retryPolicy = new RetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(2));
        pool = new WorkerPool(limiter, retryPolicy);
        notified = new CopyOnWriteArrayList<>();
    }

    private static List<WorkItem> items(long from, long to) {
        return LongStream.rangeClosed(from, to).mapToObj(WorkItem::of).toList();
    }

    @Test
    void testAllItemsSucceedInPendingOrder() {
        Map<WorkItem, AtomicInteger> calls = new ConcurrentHashMap<>();
        List<WorkItem> pending = items(1, 8);

        List<ItemOutcome> outcomes = pool.run(pending,
                item -> calls.computeIfAbsent(item, k -> new AtomicInteger()).incrementAndGet(),
                3, new CancellationToken(), notified::add);

        assertEquals(pending, outcomes.stream().map(ItemOutcome::item).toList());
        assertTrue(outcomes.stream().allMatch(ItemOutcome::isSucceeded));
        assertTrue(calls.values().stream().allMatch(c -> c.get() == 1));
        assertEquals(8, notified.size());
    }

    @Test
    void testNeverRunsMoreThanConcurrencyItemsAtOnce() {
        var active = new AtomicInteger();
        var maxActive = new AtomicInteger();

        pool.run(items(1, 20), item -> {
            int now = active.incrementAndGet();
            maxActive.accumulateAndGet(now, Math::max);
            Thread.sleep(10);
            active.decrementAndGet();
        }, 3, new CancellationToken(), notified::add);

        assertThat(maxActive.get()).isBetween(1, 3);
    }

    @Test
    void testPermanentFailureIsIsolatedToItsItem() {
        List<ItemOutcome> outcomes = pool.run(items(1, 10), item -> {
            if (item.id() == 5) {
                throw new PermanentException("malformed workout page");
            }
        }, 4, new CancellationToken(), notified::add);

        assertEquals(9, outcomes.stream().filter(ItemOutcome::isSucceeded).count());
        ItemOutcome failed = outcomes.get(4);
        assertEquals(WorkItem.of(5), failed.item());
        assertEquals(ItemOutcome.Status.FAILED, failed.status());
        assertEquals(FailureKind.PERMANENT, failed.failureKind());
        assertEquals(1, failed.attempts());
        assertEquals("malformed workout page", failed.reason());
    }

    @Test
    void testTransientFailureIsRetriedUntilSuccess() {
        var attempts = new AtomicInteger();

        List<ItemOutcome> outcomes = pool.run(items(1, 1), item -> {
            if (attempts.incrementAndGet() < 3) {
                throw new TransientException("connection reset");
            }
        }, 1, new CancellationToken(), notified::add);

        assertEquals(ItemOutcome.Status.SUCCEEDED, outcomes.get(0).status());
        assertEquals(3, outcomes.get(0).attempts());
    }

    @Test
    void testTransientFailureGivesUpAfterMaxAttempts() {
        var attempts = new AtomicInteger();

        List<ItemOutcome> outcomes = pool.run(items(1, 1), item -> {
            attempts.incrementAndGet();
            throw new TransientException("503 Service Unavailable");
        }, 1, new CancellationToken(), notified::add);

        assertEquals(3, attempts.get());
        assertEquals(ItemOutcome.Status.FAILED, outcomes.get(0).status());
        assertEquals(FailureKind.TRANSIENT, outcomes.get(0).failureKind());
        assertEquals(3, outcomes.get(0).attempts());
    }

    @Test
    void testRateLimitedFailurePenalizesLimiterAndRetries() {
        RateLimiter mockLimiter = mock(RateLimiter.class);
        var rateLimitedPool = new WorkerPool(mockLimiter, retryPolicy);
        var attempts = new AtomicInteger();

        List<ItemOutcome> outcomes = rateLimitedPool.run(items(1, 1), item -> {
            if (attempts.incrementAndGet() == 1) {
                throw new RateLimitedException("429 Too Many Requests");
            }
        }, 1, new CancellationToken(), notified::add);

        assertTrue(outcomes.get(0).isSucceeded());
        verify(mockLimiter, times(2)).admit(any(CancellationToken.class));
        verify(mockLimiter).penalize();
    }

    @Test
    void testEveryAttemptIsAdmittedByTheLimiter() {
        RateLimiter mockLimiter = mock(RateLimiter.class);
        var countingPool = new WorkerPool(mockLimiter, retryPolicy);

        countingPool.run(items(1, 4), item -> {
            if (item.id() == 1) {
                throw new TransientException("timeout");
            }
        }, 2, new CancellationToken(), notified::add);

        // item 1: 3 attempts, items 2..4: 1 attempt each
        verify(mockLimiter, times(6)).admit(any(CancellationToken.class));
        verify(mockLimiter, never()).penalize();
    }

    @Test
    void testCancellationStopsNewAdmissions() {
        var token = new CancellationToken();
        var executed = new AtomicInteger();

        List<ItemOutcome> outcomes = pool.run(items(1, 5), item -> {
            executed.incrementAndGet();
            token.cancel();
        }, 1, token, notified::add);

        assertEquals(1, executed.get());
        assertEquals(ItemOutcome.Status.SUCCEEDED, outcomes.get(0).status());
        assertTrue(outcomes.subList(1, 5).stream().allMatch(o -> o.status() == ItemOutcome.Status.CANCELLED));
    }

    @Test
    void testInFlightAttemptCompletesAfterCancellation() throws Exception {
        var token = new CancellationToken();
        var started = new CountDownLatch(1);
        var release = new CountDownLatch(1);

        CompletableFuture<List<ItemOutcome>> run = CompletableFuture.supplyAsync(() -> pool.run(items(1, 3), item -> {
            if (item.id() == 1) {
                started.countDown();
                assertTrue(release.await(5, TimeUnit.SECONDS));
            } else {
                fail("no new item may start after cancellation");
            }
        }, 1, token, notified::add));

        assertTrue(started.await(5, TimeUnit.SECONDS));
        token.cancel();
        release.countDown();
        List<ItemOutcome> outcomes = run.get(5, TimeUnit.SECONDS);

        assertEquals(ItemOutcome.Status.SUCCEEDED, outcomes.get(0).status());
        assertEquals(ItemOutcome.Status.CANCELLED, outcomes.get(1).status());
        assertEquals(ItemOutcome.Status.CANCELLED, outcomes.get(2).status());
    }

    @Test
    void testCancellationInterruptsBackoff() throws Exception {
        var slowRetry = new WorkerPool(limiter, new RetryPolicy(5, Duration.ofSeconds(20), Duration.ofSeconds(20), () -> 1.0));
        var token = new CancellationToken();
        var failedOnce = new CountDownLatch(1);

        CompletableFuture<List<ItemOutcome>> run = CompletableFuture.supplyAsync(() -> slowRetry.run(items(1, 1), item -> {
            failedOnce.countDown();
            throw new TransientException("timeout");
        }, 1, token, notified::add));

        assertTrue(failedOnce.await(5, TimeUnit.SECONDS));
        long started = System.nanoTime();
        token.cancel();
        List<ItemOutcome> outcomes = run.get(5, TimeUnit.SECONDS);

        assertEquals(ItemOutcome.Status.CANCELLED, outcomes.get(0).status());
        assertEquals(1, outcomes.get(0).attempts());
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started)).isLessThan(5_000);
    }

    @Test
    void testFailingListenerDoesNotAffectOutcomes() {
        List<ItemOutcome> outcomes = pool.run(items(1, 4), item -> { }, 2, new CancellationToken(), outcome -> {
            throw new IllegalStateException("observer down");
        });

        assertTrue(outcomes.stream().allMatch(ItemOutcome::isSucceeded));
    }

    @Test
    void testEmptyPendingSetDoesNothing() {
        assertTrue(pool.run(List.of(), item -> fail("unexpected"), 2, new CancellationToken(), notified::add).isEmpty());
    }

    @Test
    void testRejectsInvalidConcurrency() {
        assertThrows(IllegalArgumentException.class,
                () -> pool.run(items(1, 1), item -> { }, 0, new CancellationToken(), notified::add));
    }
}
