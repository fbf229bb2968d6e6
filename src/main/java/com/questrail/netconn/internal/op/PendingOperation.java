package com.questrail.netconn.internal.op;

import com.questrail.netconn.internal.time.Cancellable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * PendingOperation
 * =============================================================================
 * Bridges event notifications into a single {@link CompletableFuture}.
 *
 * <p>A pending operation races several sources against each other: data
 * arriving, a write being acknowledged, the transport closing, ending or
 * failing, and an optional timer. The first source to call one of the
 * {@code resolve}/{@code reject}/{@code timeOut} methods wins; every later call
 * is a no-op returning {@code false}. Winning cancels the timer and runs the
 * registered detach hooks before the future is completed, so continuations
 * never observe a half-settled operation.</p>
 *
 * <p>The state guard is atomic, which lets the listener share this class across
 * its acceptor thread and caller threads.</p>
 *
 * @param <T> result type
 */
public final class PendingOperation<T>
{
    private final String name;
    private final CompletableFuture<T> future = new CompletableFuture<>();
    private final AtomicReference<OperationState> state = new AtomicReference<>(OperationState.WAITING);

    private final List<Runnable> detachHooks = new ArrayList<>(2);
    private volatile Cancellable timer = Cancellable.NONE;

    public PendingOperation(String name)
    {
        this.name = Objects.requireNonNull(name, "name");
    }

    public boolean resolve(T value)
    {
        if (!transition(OperationState.RESOLVED)) {
            return false;
        }
        future.complete(value);
        return true;
    }

    public boolean reject(Throwable cause)
    {
        Objects.requireNonNull(cause, "cause");
        if (!transition(OperationState.REJECTED)) {
            return false;
        }
        future.completeExceptionally(cause);
        return true;
    }

    /**
     * Settle because the operation's own timer fired.
     */
    public boolean timeOut(Throwable cause)
    {
        Objects.requireNonNull(cause, "cause");
        if (!transition(OperationState.TIMED_OUT)) {
            return false;
        }
        future.completeExceptionally(cause);
        return true;
    }

    /**
     * Attach the timer guarding this operation. If the operation has already
     * settled the timer is cancelled immediately.
     */
    public void armTimer(Cancellable timer)
    {
        this.timer = Objects.requireNonNull(timer, "timer");
        if (!isWaiting()) {
            timer.cancel();
        }
    }

    /**
     * Register a hook run exactly once when the operation settles, typically to
     * remove the listeners that were racing for it.
     */
    public synchronized void onSettle(Runnable hook)
    {
        Objects.requireNonNull(hook, "hook");
        if (isWaiting()) {
            detachHooks.add(hook);
        }
        else {
            hook.run();
        }
    }

    public boolean isWaiting()
    {
        return state.get() == OperationState.WAITING;
    }

    public OperationState state()
    {
        return state.get();
    }

    public CompletableFuture<T> future()
    {
        return future;
    }

    private boolean transition(OperationState target)
    {
        if (!state.compareAndSet(OperationState.WAITING, target)) {
            return false;
        }
        timer.cancel();
        List<Runnable> hooks;
        synchronized (this) {
            hooks = new ArrayList<>(detachHooks);
            detachHooks.clear();
        }
        hooks.forEach(Runnable::run);
        return true;
    }

    @Override
    public String toString()
    {
        return name + "[" + state.get() + "]";
    }
}
