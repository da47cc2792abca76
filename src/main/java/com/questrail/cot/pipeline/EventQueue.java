package com.questrail.cot.pipeline;

import java.time.Duration;
import java.util.Optional;

/**
 * FIFO hand-off between one producer and one consumer.
 *
 * <p>Bounded queues never block the producer: when full, the oldest element is
 * dropped (and reported) to make room.</p>
 */
public interface EventQueue<T>
{
    void put(T item);

    /**
     * Waits up to {@code timeout} for an element. Running out of time is not an error.
     *
     * @return the head element, or empty on timeout or interrupt (the interrupt
     *         flag is preserved)
     */
    Optional<T> poll(Duration timeout);

    int size();

    /** Maximum depth; 0 means unbounded. */
    int capacity();
}
