package com.questrail.netconn.internal.op;

import com.questrail.netconn.time.DeterministicScheduler;
import com.questrail.netconn.time.ManualMonotonicClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class PendingOperationTest
{
    @Test
    void firstSettlementWins()
    {
        PendingOperation<String> op = new PendingOperation<>("read");

        assertTrue(op.resolve("a"));
        assertFalse(op.reject(new IllegalStateException("late")));
        assertFalse(op.resolve("b"));

        assertEquals(OperationState.RESOLVED, op.state());
        assertEquals("a", op.future().join());
    }

    @Test
    void rejectionAfterTimeoutIsIgnored()
    {
        PendingOperation<String> op = new PendingOperation<>("read");
        RuntimeException timeout = new RuntimeException("timeout");

        assertTrue(op.timeOut(timeout));
        assertFalse(op.reject(new RuntimeException("closed")));

        assertEquals(OperationState.TIMED_OUT, op.state());
        CompletionException e = assertThrows(CompletionException.class, () -> op.future().join());
        assertSame(timeout, e.getCause());
    }

    @Test
    void settlingCancelsTimer()
    {
        ManualMonotonicClock clock = new ManualMonotonicClock();
        DeterministicScheduler scheduler = new DeterministicScheduler(clock);
        PendingOperation<String> op = new PendingOperation<>("read");

        op.armTimer(scheduler.scheduleAfter(Duration.ofMillis(10), clock,
                () -> op.timeOut(new RuntimeException("timeout"))));
        assertEquals(1, scheduler.liveTaskCount());

        op.resolve("done");
        assertEquals(0, scheduler.liveTaskCount());

        clock.advanceMillis(20);
        scheduler.runDueTasks();
        assertEquals(OperationState.RESOLVED, op.state());
    }

    @Test
    void timerFiresWhenNotSettled()
    {
        ManualMonotonicClock clock = new ManualMonotonicClock();
        DeterministicScheduler scheduler = new DeterministicScheduler(clock);
        PendingOperation<String> op = new PendingOperation<>("read");
        op.armTimer(scheduler.scheduleAfter(Duration.ofMillis(10), clock,
                () -> op.timeOut(new RuntimeException("timeout"))));

        clock.advanceMillis(9);
        scheduler.runDueTasks();
        assertTrue(op.isWaiting());

        clock.advanceMillis(1);
        scheduler.runDueTasks();
        assertEquals(OperationState.TIMED_OUT, op.state());
        assertTrue(op.state().isTerminal());
    }

    @Test
    void hooksRunOnceAndBeforeCompletion()
    {
        PendingOperation<String> op = new PendingOperation<>("accept");
        AtomicInteger runs = new AtomicInteger();
        AtomicBoolean completedBeforeHook = new AtomicBoolean();
        op.onSettle(() -> {
            runs.incrementAndGet();
            completedBeforeHook.set(op.future().isDone());
        });

        op.reject(new RuntimeException("closed"));
        op.reject(new RuntimeException("again"));
        assertEquals(1, runs.get());
        assertFalse(completedBeforeHook.get());
    }

    @Test
    void hookRegisteredAfterSettlementRunsImmediately()
    {
        PendingOperation<String> op = new PendingOperation<>("listen");
        op.reject(new RuntimeException("bind"));
        AtomicInteger runs = new AtomicInteger();
        op.onSettle(runs::incrementAndGet);
        assertEquals(1, runs.get());
        assertTrue(op.future().isCompletedExceptionally());
    }
}
