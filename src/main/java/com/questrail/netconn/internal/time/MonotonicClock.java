package com.questrail.netconn.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for read deadlines.
 *
 * <p>Deadlines are computed from a monotonic tick, never from wall-clock time,
 * so NTP or DST adjustments cannot fire or postpone a read timeout.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Only
     * differences between two values are meaningful.
     */
    long nowNanos();
}
