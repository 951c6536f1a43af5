package com.questrail.poolheat.cloud.internal.time;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ScheduledExecutorSchedulerTest
 * -----------------------------------------------------------------------------
 * Real-time tests for the production scheduler. Deadlines are short and waits
 * generous; nothing asserts an upper bound on lateness.
 */
class ScheduledExecutorSchedulerTest {

    private final MonotonicClock clock = SystemMonotonicClock.INSTANCE;

    private ScheduledExecutorService executor;
    private ScheduledExecutorScheduler scheduler;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadScheduledExecutor();
        scheduler = new ScheduledExecutorScheduler(executor, clock);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void taskRunsNoEarlierThanDeadline() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        long deadline = clock.nowNanos() + TimeUnit.MILLISECONDS.toNanos(30);
        long[] ranAt = new long[1];

        scheduler.scheduleAtNanos(deadline, () -> {
            ranAt[0] = clock.nowNanos();
            latch.countDown();
        });

        assertTrue(latch.await(2, TimeUnit.SECONDS));
        assertTrue(ranAt[0] - deadline >= 0);
    }

    @Test
    void pastDeadlineRunsPromptly() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        scheduler.scheduleAtNanos(clock.nowNanos() - TimeUnit.SECONDS.toNanos(1), latch::countDown);

        assertTrue(latch.await(2, TimeUnit.SECONDS));
    }

    @Test
    void cancelledTaskNeverRuns() throws InterruptedException {
        AtomicBoolean cancelledRan = new AtomicBoolean(false);
        CountDownLatch later = new CountDownLatch(1);
        long now = clock.nowNanos();

        Cancellable handle = scheduler.scheduleAtNanos(now + TimeUnit.MILLISECONDS.toNanos(20), () -> cancelledRan.set(true));
        scheduler.scheduleAtNanos(now + TimeUnit.MILLISECONDS.toNanos(40), later::countDown);

        assertTrue(handle.cancel());
        assertTrue(later.await(2, TimeUnit.SECONDS));
        assertFalse(cancelledRan.get());
    }

    @Test
    void cancelAfterRunReturnsFalse() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        Cancellable handle = scheduler.scheduleAtNanos(clock.nowNanos(), latch::countDown);

        assertTrue(latch.await(2, TimeUnit.SECONDS));
        assertFalse(handle.cancel());
    }

    @Test
    void tasksRunInDeadlineOrder() throws InterruptedException {
        List<Integer> order = new CopyOnWriteArrayList<>();
        CountDownLatch latch = new CountDownLatch(3);

        scheduler.scheduleAfter(Duration.ofMillis(30), () -> { order.add(3); latch.countDown(); });
        scheduler.scheduleAfter(Duration.ofMillis(20), () -> { order.add(2); latch.countDown(); });
        scheduler.scheduleAfter(Duration.ofMillis(10), () -> { order.add(1); latch.countDown(); });

        assertTrue(latch.await(2, TimeUnit.SECONDS));
        assertEquals(List.of(1, 2, 3), order);
    }

    @Test
    void schedulingAfterShutdownIsDropped() {
        executor.shutdown();

        Cancellable handle = scheduler.scheduleAfter(Duration.ofMillis(10), () -> fail("must not run"));

        assertSame(Cancellable.NONE, handle);
    }
}
