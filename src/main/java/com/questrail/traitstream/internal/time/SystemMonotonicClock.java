package com.questrail.traitstream.internal.time;

/**
 * SystemMonotonicClock
 * =============================================================================
 * Production {@link MonotonicClock} implementation backed by {@link System#nanoTime()}.
 *
 * <p>Not affected by wall-clock adjustments. For deterministic testing, use
 * {@code ManualMonotonicClock} instead.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>This implementation is thread-safe.</p>
 */
public enum SystemMonotonicClock implements MonotonicClock {
    /**
     * Singleton instance.
     */
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
