package com.questrail.cot.transport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * FakeChannelWriter
 * -----------------------------------------------------------------------------
 * Test-only {@link ChannelWriter} that records every write. It can be told to
 * fail so tests can observe how callers handle a dead channel.
 */
public final class FakeChannelWriter implements ChannelWriter {

    private final List<byte[]> written = Collections.synchronizedList(new ArrayList<>());
    private volatile CountDownLatch latch = new CountDownLatch(0);
    private volatile boolean failing;

    @Override
    public void write(byte[] frame) {
        Objects.requireNonNull(frame, "frame");
        if (failing) {
            throw new ChannelIOException("Fake channel failed");
        }
        written.add(frame.clone());
        latch.countDown();
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public void expectWrites(int count) {
        latch = new CountDownLatch(count);
    }

    public boolean awaitWrites(long timeout, TimeUnit unit) throws InterruptedException {
        return latch.await(timeout, unit);
    }

    public void failFromNowOn() {
        failing = true;
    }

    public List<byte[]> written() {
        synchronized (written) {
            return new ArrayList<>(written);
        }
    }
}
