package com.questrail.cot.pipeline;

import com.questrail.cot.observability.CotFrameDroppedEvent;
import com.questrail.cot.observability.CotObservabilitySink;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;

/**
 * {@link EventQueue} over a non-blocking {@link Queue}, such as an adapter onto a
 * queue shared with another process.
 *
 * <p>{@link #poll(Duration)} re-checks the delegate every {@code pollInterval}
 * until the timeout expires, which gives the same contract as a blocking wait.</p>
 */
public final class PollingEventQueue<T> implements EventQueue<T>
{
    private final Queue<T> delegate;
    private final int capacity;
    private final Duration pollInterval;
    private final CotObservabilitySink sink;

    /**
     * @param capacity maximum depth enforced on top of the delegate, 0 for none
     */
    public PollingEventQueue(Queue<T> delegate, int capacity, Duration pollInterval, CotObservabilitySink sink) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be >= 0");
        }
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        this.capacity = capacity;
        this.pollInterval = pollInterval;
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Override
    public void put(T item) {
        Objects.requireNonNull(item, "item");
        synchronized (delegate) {
            while (capacity > 0 && delegate.size() >= capacity) {
                if (!dropOldest()) {
                    break;
                }
            }
            if (!delegate.offer(item)) {
                // Delegate has its own bound.
                dropOldest();
                if (!delegate.offer(item)) {
                    throw new IllegalStateException("Queue rejected element after dropping the oldest");
                }
            }
        }
    }

    @Override
    public Optional<T> poll(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            T item;
            synchronized (delegate) {
                item = delegate.poll();
            }
            if (item != null) {
                return Optional.of(item);
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return Optional.empty();
            }
            try {
                Thread.sleep(Math.max(1, Math.min(pollInterval.toMillis(), remaining / 1_000_000L)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
        }
    }

    @Override
    public int size() {
        synchronized (delegate) {
            return delegate.size();
        }
    }

    @Override
    public int capacity() {
        return capacity;
    }

    private boolean dropOldest() {
        if (delegate.poll() == null) {
            return false;
        }
        sink.onFrameDropped(new CotFrameDroppedEvent(Instant.now(), CotFrameDroppedEvent.Reason.QUEUE_FULL, 1));
        return true;
    }
}
