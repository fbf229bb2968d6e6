package com.questrail.netconn.internal.time;

/**
 * Cancellation handle for a scheduled timer, such as the timer guarding a
 * pending read.
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if the task will not run; {@code false} if it already
     *         ran or was cancelled before.
     */
    boolean cancel();

    /** Handle for "nothing was scheduled". */
    Cancellable NONE = () -> false;
}
