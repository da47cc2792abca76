package com.questrail.cot.codec;

import com.questrail.cot.CotClientException;

import java.util.List;

/**
 * No frame boundary was found within the framer's scan window.
 *
 * <p>Non-fatal: by the time this is thrown the framer has already discarded the
 * buffered data and is ready to accept the next frame. Valid frames delimited in
 * the same {@link StreamFramer#feed(byte[])} call are carried by
 * {@link #completedFrames()} so they are not lost.</p>
 */
public final class FrameTooLongException extends CotClientException
{
    private final long discardedBytes;
    private final transient List<byte[]> completedFrames;

    public FrameTooLongException(long discardedBytes, int maxFrameLength) {
        this(discardedBytes, maxFrameLength, List.of());
    }

    public FrameTooLongException(long discardedBytes, int maxFrameLength, List<byte[]> completedFrames) {
        super("No frame boundary within " + maxFrameLength + " bytes; discarded " + discardedBytes);
        this.discardedBytes = discardedBytes;
        this.completedFrames = List.copyOf(completedFrames);
    }

    public long discardedBytes() {
        return discardedBytes;
    }

    public List<byte[]> completedFrames() {
        return completedFrames;
    }
}
