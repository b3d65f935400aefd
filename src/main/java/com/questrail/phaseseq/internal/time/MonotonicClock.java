package com.questrail.phaseseq.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for deadlines and elapsed-time measurement.
 *
 * <h2>Binding invariant</h2>
 * Time boxes (the registration timeout) and stage durations MUST use a
 * monotonic time source. Wall-clock time is permitted only for event
 * timestamps.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Values are
     * only meaningful for elapsed time computations.
     */
    long nowNanos();
}
