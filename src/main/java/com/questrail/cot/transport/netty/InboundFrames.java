package com.questrail.cot.transport.netty;

import com.questrail.cot.transport.ChannelIOException;
import com.questrail.cot.transport.ChannelReader;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Hand-off between a Netty event loop and a blocking reader thread.
 *
 * <p>The event loop {@link #offer offers} copied payloads; once the channel goes
 * away it records the reason with {@link #closed}. Readers drain remaining
 * payloads first and then get a {@link ChannelIOException} on every further
 * call.</p>
 */
final class InboundFrames implements ChannelReader
{
    private static final Object EOF = new Object();

    private final String name;
    private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
    private volatile Throwable closeCause;
    private volatile boolean closed;

    InboundFrames(String name) {
        this.name = name;
    }

    void offer(byte[] payload) {
        if (!closed) {
            queue.offer(payload);
        }
    }

    void closed(Throwable cause) {
        if (closed) {
            return;
        }
        closeCause = cause;
        closed = true;
        queue.offer(EOF);
    }

    @Override
    public Optional<byte[]> read(Duration timeout) {
        Object next;
        try {
            next = queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChannelIOException("Interrupted while reading " + name, e);
        }
        if (next == null) {
            return Optional.empty();
        }
        if (next == EOF) {
            // Leave the marker for the next caller.
            queue.offer(EOF);
            Throwable cause = closeCause;
            throw cause == null
                    ? new ChannelIOException("Connection closed: " + name)
                    : new ChannelIOException("Connection failed: " + name, cause);
        }
        return Optional.of((byte[]) next);
    }
}
