package com.questrail.cot.pipeline;

import com.questrail.cot.observability.CotErrorEvent;
import com.questrail.cot.observability.CotObservabilitySink;
import com.questrail.cot.observability.CotWorkerEvent;
import com.questrail.cot.observability.NullObservabilitySink;

import java.time.Instant;
import java.util.Objects;

/**
 * Worker
 * =============================================================================
 * A loop that repeats one unit of work until stopped or failed.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   IDLE  --run()-->  RUNNING  --stop() / interrupt / failure-->  STOPPED
 * </pre>
 * A worker runs at most once. Cancellation is cooperative: {@link #stop()} is
 * observed between iterations, so {@link #runOnce()} should return within a
 * bounded time (queue polls and channel reads take a timeout for this reason).
 *
 * <h2>Failure</h2>
 * An exception thrown by {@link #runOnce()} while the worker is live is reported to
 * the sink and rethrown from {@link #run()}. The same exception after
 * {@link #stop()} is a side effect of shutdown (a channel closed under a pending
 * read) and ends the loop quietly.
 */
public abstract class Worker implements Runnable
{
    private final String name;
    protected final CotObservabilitySink observabilitySink;

    private volatile boolean stopRequested;
    private volatile WorkerState state = WorkerState.IDLE;

    protected Worker(String name, CotObservabilitySink observabilitySink) {
        this.name = Objects.requireNonNull(name, "name");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * One iteration of the loop.
     *
     * @throws InterruptedException to end the loop cooperatively
     */
    protected abstract void runOnce() throws InterruptedException;

    @Override
    public final void run() {
        synchronized (this) {
            if (state != WorkerState.IDLE) {
                throw new IllegalStateException("Worker " + name + " already " + state);
            }
            transition(WorkerState.RUNNING);
        }
        try {
            while (!stopRequested && !Thread.currentThread().isInterrupted()) {
                runOnce();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            if (!stopRequested) {
                observabilitySink.onError(new CotErrorEvent(Instant.now(), "Worker " + name + " failed", e));
                throw e;
            }
        } finally {
            transition(WorkerState.STOPPED);
        }
    }

    /**
     * Requests the loop to end after the current iteration. Safe from any thread.
     */
    public void stop() {
        stopRequested = true;
    }

    public boolean isStopRequested() {
        return stopRequested;
    }

    public WorkerState state() {
        return state;
    }

    public String name() {
        return name;
    }

    private void transition(WorkerState to) {
        WorkerState from = state;
        state = to;
        observabilitySink.onWorkerEvent(new CotWorkerEvent(Instant.now(), name, from, to));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + name + ", " + state + "}";
    }
}
