package com.questrail.cot.pipeline;

import com.questrail.cot.codec.CotFrameDecoder;
import com.questrail.cot.codec.ProtocolVersion;
import com.questrail.cot.model.CotPayload;
import com.questrail.cot.observability.CotObservabilitySink;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Fills the inbound queue from a channel: read, frame, decode, put.
 *
 * <p>Undecodable frames still reach the queue, as raw payloads. A read failure ends
 * the worker.</p>
 */
public final class ReceiveWorker extends Worker
{
    static final Duration DEFAULT_READ_TIMEOUT = Duration.ofMillis(250);

    private final FramedChannelReader reader;
    private final EventQueue<CotPayload> queue;
    private final CotFrameDecoder decoder;
    private final ProtocolVersion version;
    private final Duration readTimeout;
    private final Sleeper sleeper;

    public ReceiveWorker(String name,
                         FramedChannelReader reader,
                         EventQueue<CotPayload> queue,
                         CotFrameDecoder decoder,
                         ProtocolVersion version,
                         CotObservabilitySink observabilitySink)
    {
        this(name, reader, queue, decoder, version, DEFAULT_READ_TIMEOUT, Sleeper.SYSTEM, observabilitySink);
    }

    ReceiveWorker(String name,
                  FramedChannelReader reader,
                  EventQueue<CotPayload> queue,
                  CotFrameDecoder decoder,
                  ProtocolVersion version,
                  Duration readTimeout,
                  Sleeper sleeper,
                  CotObservabilitySink observabilitySink)
    {
        super(name, observabilitySink);
        this.reader = Objects.requireNonNull(reader, "reader");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.version = Objects.requireNonNull(version, "version");
        this.readTimeout = Objects.requireNonNull(readTimeout, "readTimeout");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    @Override
    protected void runOnce() throws InterruptedException {
        List<byte[]> frames = reader.readFrames(readTimeout);
        for (byte[] frame : frames) {
            queue.put(decoder.decode(frame, version));
        }
        if (!frames.isEmpty()) {
            sleeper.sleep(PacingPolicy.MINIMUM_YIELD);
        }
    }
}
