package com.questrail.cot.codec.impl;

import com.questrail.cot.codec.FrameTooLongException;
import com.questrail.cot.codec.StreamFramer;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared accumulate/extract loop for stream framers.
 *
 * <p>Subclasses implement {@link #extract(FrameBuffer)}, which removes and returns
 * one complete frame or returns {@code null} when more bytes are needed. When the
 * buffer outgrows {@code maxFrameLength} without producing a frame, everything
 * buffered is discarded and {@link FrameTooLongException} is thrown.</p>
 */
abstract class AbstractStreamFramer implements StreamFramer
{
    protected final int maxFrameLength;
    private final FrameBuffer buffer = new FrameBuffer();

    protected AbstractStreamFramer(int maxFrameLength) {
        if (maxFrameLength <= 0) {
            throw new IllegalArgumentException("maxFrameLength must be positive");
        }
        this.maxFrameLength = maxFrameLength;
    }

    @Override
    public final List<byte[]> feed(byte[] bytes) {
        buffer.append(bytes);
        List<byte[]> frames = new ArrayList<>();
        long discarded = 0;
        while (true) {
            byte[] frame;
            try {
                frame = extract(buffer);
            } catch (FrameTooLongException e) {
                discarded += e.discardedBytes();
                continue;
            }
            if (frame == null) {
                break;
            }
            frames.add(frame);
        }
        if (buffer.size() > maxFrameLength) {
            discarded += buffer.size();
            buffer.clear();
        }
        if (discarded > 0) {
            throw new FrameTooLongException(discarded, maxFrameLength, frames);
        }
        return frames;
    }

    @Override
    public final int buffered() {
        return buffer.size();
    }

    /**
     * @throws FrameTooLongException after removing an oversized frame from the buffer;
     *                               extraction continues with the remaining bytes
     */
    protected abstract byte[] extract(FrameBuffer buffer);

    static void skipWhitespace(FrameBuffer buffer) {
        int n = 0;
        while (n < buffer.size()) {
            int b = buffer.get(n);
            if (b != ' ' && b != '\n' && b != '\r' && b != '\t' && b != 0) {
                break;
            }
            n++;
        }
        if (n > 0) {
            buffer.skip(n);
        }
    }
}
