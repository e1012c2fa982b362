package com.questrail.traitstream.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used strictly for event timestamps.
 *
 * <p>
 * This clock may jump due to DST, NTP adjustments, or explicit time setting.
 * It MUST NOT be used for read timeouts or reconnect spacing.
 * </p>
 */
public interface WallClock
{
    Instant now();
}
