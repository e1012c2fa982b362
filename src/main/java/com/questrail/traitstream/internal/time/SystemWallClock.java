package com.questrail.traitstream.internal.time;

import java.time.Instant;

/**
 * SystemWallClock
 * =============================================================================
 * Production {@link WallClock} implementation backed by {@link Instant#now()}.
 *
 * <p><strong>Do not use for operational timing.</strong> Session timing uses
 * {@link MonotonicClock} exclusively.</p>
 */
public enum SystemWallClock implements WallClock {
    INSTANCE;

    @Override
    public Instant now() {
        return Instant.now();
    }
}
