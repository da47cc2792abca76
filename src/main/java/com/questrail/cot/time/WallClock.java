package com.questrail.cot.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Source of absolute UTC time for event timestamps.
 *
 * <p>CoT timestamps ({@code time}, {@code start}, {@code stale}) are wall-clock
 * values shared with remote peers, so they cannot come from a monotonic source.
 * Injecting the clock keeps event construction deterministic under test.</p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
