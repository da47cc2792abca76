package com.questrail.cot.observability;

import com.questrail.cot.pipeline.WorkerState;

import java.time.Instant;

/**
 * Record representing a worker lifecycle transition.
 */
public record CotWorkerEvent(
    Instant timestamp,
    String worker,
    WorkerState from,
    WorkerState to
) {
}
