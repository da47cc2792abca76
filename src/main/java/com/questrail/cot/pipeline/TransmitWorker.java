package com.questrail.cot.pipeline;

import com.questrail.cot.codec.CotFrameEncoder;
import com.questrail.cot.codec.ProtocolVersion;
import com.questrail.cot.codec.TakProtoVariant;
import com.questrail.cot.model.CotPayload;
import com.questrail.cot.observability.CotObservabilitySink;
import com.questrail.cot.transport.ChannelWriter;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Drains the outbound queue onto a channel: poll, encode, write, pause.
 *
 * <p>An empty poll is not an error; the loop simply comes round again. A write
 * failure ends the worker.</p>
 */
public final class TransmitWorker extends Worker
{
    static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofMillis(250);

    private final EventQueue<CotPayload> queue;
    private final ChannelWriter writer;
    private final CotFrameEncoder encoder;
    private final ProtocolVersion version;
    private final TakProtoVariant variant;
    private final PacingPolicy pacing;
    private final Duration pollTimeout;
    private final Sleeper sleeper;

    public TransmitWorker(String name,
                          EventQueue<CotPayload> queue,
                          ChannelWriter writer,
                          CotFrameEncoder encoder,
                          ProtocolVersion version,
                          TakProtoVariant variant,
                          PacingPolicy pacing,
                          CotObservabilitySink observabilitySink)
    {
        this(name, queue, writer, encoder, version, variant, pacing, DEFAULT_POLL_TIMEOUT, Sleeper.SYSTEM, observabilitySink);
    }

    TransmitWorker(String name,
                   EventQueue<CotPayload> queue,
                   ChannelWriter writer,
                   CotFrameEncoder encoder,
                   ProtocolVersion version,
                   TakProtoVariant variant,
                   PacingPolicy pacing,
                   Duration pollTimeout,
                   Sleeper sleeper,
                   CotObservabilitySink observabilitySink)
    {
        super(name, observabilitySink);
        this.queue = Objects.requireNonNull(queue, "queue");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.version = Objects.requireNonNull(version, "version");
        this.variant = Objects.requireNonNull(variant, "variant");
        this.pacing = Objects.requireNonNull(pacing, "pacing");
        this.pollTimeout = Objects.requireNonNull(pollTimeout, "pollTimeout");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    @Override
    protected void runOnce() throws InterruptedException {
        Optional<CotPayload> next = queue.poll(pollTimeout);
        if (next.isEmpty()) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException();
            }
            return;
        }
        writer.write(encoder.encode(next.get(), version, variant));
        sleeper.sleep(pacing.nextDelay());
    }
}
