package com.questrail.netconn.internal.time;

import io.netty.channel.DefaultEventLoop;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ScheduledExecutorSchedulerTest
 * -----------------------------------------------------------------------------
 * The production scheduler runs on a Netty event loop, as it does inside a
 * connection.
 *
 * Note: These tests use real time. Tolerances are generous.
 */
class ScheduledExecutorSchedulerTest {

    private DefaultEventLoop loop;
    private ScheduledExecutorScheduler scheduler;

    @BeforeEach
    void setUp() {
        loop = new DefaultEventLoop();
        scheduler = new ScheduledExecutorScheduler(loop, SystemMonotonicClock.INSTANCE);
    }

    @AfterEach
    void tearDown() {
        loop.shutdownGracefully(0, 1, TimeUnit.SECONDS);
    }

    @Test
    void taskRunsOnEventLoopAfterDelay() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<Boolean> onLoop = new AtomicReference<>();

        long start = System.nanoTime();
        scheduler.scheduleAfter(Duration.ofMillis(50), SystemMonotonicClock.INSTANCE, () -> {
            onLoop.set(loop.inEventLoop());
            latch.countDown();
        });

        assertTrue(latch.await(1, TimeUnit.SECONDS), "Task should execute");
        assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(45));
        assertEquals(Boolean.TRUE, onLoop.get());
    }

    @Test
    void pastDeadlineExecutesImmediately() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        long deadline = SystemMonotonicClock.INSTANCE.nowNanos() - TimeUnit.SECONDS.toNanos(1);

        scheduler.scheduleAtNanos(deadline, latch::countDown);

        assertTrue(latch.await(200, TimeUnit.MILLISECONDS), "Task should execute immediately");
    }

    @Test
    void cancelPreventsExecution() throws InterruptedException {
        AtomicBoolean executed = new AtomicBoolean(false);
        long deadline = SystemMonotonicClock.INSTANCE.nowNanos() + TimeUnit.MILLISECONDS.toNanos(100);

        Cancellable handle = scheduler.scheduleAtNanos(deadline, () -> executed.set(true));
        assertTrue(handle.cancel(), "Cancel should succeed");

        Thread.sleep(150);
        assertFalse(executed.get(), "Cancelled task should not execute");
    }

    @Test
    void cancelAfterExecutionReturnsFalse() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        Cancellable handle = scheduler.scheduleAtNanos(SystemMonotonicClock.INSTANCE.nowNanos(), latch::countDown);

        assertTrue(latch.await(200, TimeUnit.MILLISECONDS));
        Thread.sleep(20);
        assertFalse(handle.cancel(), "Cancel after execution should return false");
    }

    @Test
    void negativeDelayIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> scheduler.scheduleAfter(Duration.ofMillis(-1), SystemMonotonicClock.INSTANCE, () -> {}));
    }
}
