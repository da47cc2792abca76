package com.questrail.cot.pipeline;

/**
 * Lifecycle of a {@link Worker}. Transitions only move forward.
 */
public enum WorkerState {
    IDLE,
    RUNNING,
    STOPPED
}
