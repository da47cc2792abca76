package com.questrail.cot.pipeline;

import com.questrail.cot.codec.FrameTooLongException;
import com.questrail.cot.codec.StreamFramer;
import com.questrail.cot.observability.CotFrameDroppedEvent;
import com.questrail.cot.observability.CotObservabilitySink;
import com.questrail.cot.transport.ChannelReader;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Turns channel reads into whole frames.
 *
 * <p>Datagram channels deliver one frame per read and need no framer. Stream
 * channels pass every chunk through a {@link StreamFramer}; a chunk may yield zero
 * or several frames. Oversized frames are reported and dropped, and reading goes
 * on.</p>
 */
public final class FramedChannelReader
{
    private final ChannelReader reader;
    private final StreamFramer framer;
    private final CotObservabilitySink observabilitySink;

    /**
     * @param framer {@code null} for datagram channels
     */
    public FramedChannelReader(ChannelReader reader, StreamFramer framer, CotObservabilitySink observabilitySink) {
        this.reader = Objects.requireNonNull(reader, "reader");
        this.framer = framer;
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    /**
     * @return frames completed by whatever arrived within {@code timeout}; empty when
     *         nothing (or only part of a frame) arrived
     * @throws com.questrail.cot.transport.ChannelIOException when the channel is gone
     */
    public List<byte[]> readFrames(Duration timeout) {
        byte[] chunk = reader.read(timeout).orElse(null);
        if (chunk == null || chunk.length == 0) {
            return List.of();
        }
        if (framer == null) {
            return List.of(chunk);
        }
        try {
            return framer.feed(chunk);
        } catch (FrameTooLongException e) {
            observabilitySink.onFrameDropped(new CotFrameDroppedEvent(
                    Instant.now(), CotFrameDroppedEvent.Reason.FRAME_TOO_LONG, e.discardedBytes()));
            return e.completedFrames();
        }
    }
}
