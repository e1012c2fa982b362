package com.questrail.traitstream.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for read timeouts and retry spacing.
 *
 * <h2>Binding invariant</h2>
 * Session timing (idle windows, read timeouts, reconnect delays) MUST use a
 * monotonic time source. Wall-clock time (e.g. {@code Instant.now()}) is
 * permitted only for observability.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     *
     * <p>
     * Values are only meaningful for elapsed time computations.
     * </p>
     */
    long nowNanos();
}
