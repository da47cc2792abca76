package com.questrail.cot.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the client stack.
 */
public record CotErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
