package com.questrail.cot.pipeline;

import com.questrail.cot.config.ConfigKeys;
import com.questrail.cot.config.CotClientConfig;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * Delay applied by the transmit worker after each write.
 *
 * <ul>
 *   <li>{@link #minimumYield()}: a one-millisecond pause so an idle loop never
 *       spins.</li>
 *   <li>{@link #fixed(Duration)}: the same delay after every send.</li>
 *   <li>{@link #randomUpTo(Duration, Random)}: a uniformly random delay in
 *       {@code [0, max]}, for servers that throttle clients that send in bursts.</li>
 * </ul>
 */
public interface PacingPolicy
{
    Duration MINIMUM_YIELD = Duration.ofMillis(1);

    Duration nextDelay();

    static PacingPolicy minimumYield() {
        return () -> MINIMUM_YIELD;
    }

    static PacingPolicy fixed(Duration delay) {
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be non-negative");
        }
        return () -> delay;
    }

    static PacingPolicy randomUpTo(Duration max, Random random) {
        Objects.requireNonNull(random, "random");
        if (max.isNegative()) {
            throw new IllegalArgumentException("max must be non-negative");
        }
        long maxNanos = max.toNanos();
        return () -> Duration.ofNanos((long) (random.nextDouble() * maxNanos));
    }

    /**
     * {@code COT_SLEEP} selects a fixed delay; otherwise {@code FTS_COMPAT} selects a
     * random delay bounded by {@code COT_SLEEP_MAX}; otherwise the minimum yield.
     */
    static PacingPolicy fromConfig(CotClientConfig config) {
        if (config.isSet(ConfigKeys.COT_SLEEP)) {
            return fixed(config.getSeconds(ConfigKeys.COT_SLEEP, 0));
        }
        if (config.getBoolean(ConfigKeys.FTS_COMPAT)) {
            return randomUpTo(config.getSeconds(ConfigKeys.COT_SLEEP_MAX, ConfigKeys.DEFAULT_SLEEP_MAX_SECONDS), new Random());
        }
        return minimumYield();
    }
}
