package com.questrail.cot.transport;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ChannelPair
 * =============================================================================
 * The reader and writer produced for one destination.
 *
 * <h2>Ownership</h2>
 * Whoever receives a pair owns both ends exclusively until {@link #close()}. The
 * writer is not safe for concurrent use by several producers.
 *
 * <p>Write-only destinations have no reader: {@link #reader()} is empty and there
 * is no local receive socket behind the pair.</p>
 */
public final class ChannelPair implements AutoCloseable
{
    private final Destination destination;
    private final ChannelReader reader;
    private final ChannelWriter writer;
    private final Runnable closer;
    private final AtomicBoolean closed = new AtomicBoolean();

    /**
     * @param reader may be {@code null} for write-only destinations
     * @param closer releases the underlying resources; invoked at most once
     */
    public ChannelPair(Destination destination, ChannelReader reader, ChannelWriter writer, Runnable closer) {
        this.destination = Objects.requireNonNull(destination, "destination");
        this.reader = reader;
        this.writer = Objects.requireNonNull(writer, "writer");
        this.closer = Objects.requireNonNull(closer, "closer");
    }

    public Destination destination() {
        return destination;
    }

    public Optional<ChannelReader> reader() {
        return Optional.ofNullable(reader);
    }

    public ChannelWriter writer() {
        return writer;
    }

    /**
     * {@code true} when reads return stream chunks that must be re-framed.
     */
    public boolean streamOriented() {
        return destination.scheme().isStreamOriented();
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            closer.run();
        }
    }

    @Override
    public String toString() {
        return "ChannelPair{" + destination + (reader == null ? ", write-only" : "") + (isClosed() ? ", closed}" : "}");
    }
}
