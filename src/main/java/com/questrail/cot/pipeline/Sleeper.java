package com.questrail.cot.pipeline;

import java.time.Duration;

/**
 * Pause between loop iterations. Replaced in tests to observe delays.
 */
@FunctionalInterface
interface Sleeper
{
    Sleeper SYSTEM = d -> {
        if (!d.isZero() && !d.isNegative()) {
            Thread.sleep(d.toMillis(), d.toNanosPart() % 1_000_000);
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
