package com.questrail.cot.pipeline;

import com.questrail.cot.observability.CotFrameDroppedEvent;
import com.questrail.cot.observability.CotObservabilitySink;
import com.questrail.cot.observability.NullObservabilitySink;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * {@link EventQueue} for producers and consumers in the same JVM.
 */
public final class InProcessEventQueue<T> implements EventQueue<T>
{
    private final int capacity;
    private final LinkedBlockingQueue<T> queue = new LinkedBlockingQueue<>();
    private final CotObservabilitySink sink;

    public InProcessEventQueue(int capacity) {
        this(capacity, NullObservabilitySink.INSTANCE);
    }

    /**
     * @param capacity maximum depth, 0 for unbounded
     */
    public InProcessEventQueue(int capacity, CotObservabilitySink sink) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be >= 0");
        }
        this.capacity = capacity;
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Override
    public void put(T item) {
        Objects.requireNonNull(item, "item");
        synchronized (queue) {
            while (capacity > 0 && queue.size() >= capacity) {
                if (queue.poll() != null) {
                    sink.onFrameDropped(new CotFrameDroppedEvent(Instant.now(), CotFrameDroppedEvent.Reason.QUEUE_FULL, 1));
                }
            }
            queue.add(item);
        }
    }

    @Override
    public Optional<T> poll(Duration timeout) {
        try {
            return Optional.ofNullable(queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public int capacity() {
        return capacity;
    }
}
