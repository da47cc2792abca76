package com.questrail.cot.transport.sink;

import com.questrail.cot.transport.ChannelIOException;
import com.questrail.cot.transport.ChannelWriter;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

/**
 * Writes each frame to an {@link OutputStream} unchanged and flushes.
 */
final class StreamSinkWriter implements ChannelWriter
{
    private final OutputStream out;
    private final String name;

    StreamSinkWriter(OutputStream out, String name) {
        this.out = Objects.requireNonNull(out, "out");
        this.name = name;
    }

    @Override
    public synchronized void write(byte[] bytes) {
        try {
            out.write(bytes);
            out.flush();
        } catch (IOException e) {
            throw new ChannelIOException("Write to " + name + " failed", e);
        }
    }

    void close() throws IOException {
        out.close();
    }
}
