package com.questrail.spooltag.bridge.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for request deadlines and reconnect delays.
 *
 * <h2>Binding invariant</h2>
 * Every correctness decision of the bridge session (is this request overdue,
 * when to reconnect) uses this clock. Wall-clock time is for observability
 * only.
 */
public interface MonotonicClock
{
    /**
     * Monotonically non-decreasing tick in nanoseconds. Only differences are
     * meaningful.
     */
    long nowNanos();
}
