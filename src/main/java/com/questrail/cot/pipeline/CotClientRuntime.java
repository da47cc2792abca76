package com.questrail.cot.pipeline;

import com.questrail.cot.CotClientException;
import com.questrail.cot.codec.CotFrameDecoder;
import com.questrail.cot.codec.CotFrameEncoder;
import com.questrail.cot.codec.ProtocolVersion;
import com.questrail.cot.codec.TakPayloadCodec;
import com.questrail.cot.codec.TakProtoVariant;
import com.questrail.cot.codec.impl.AutoDetectingStreamFramer;
import com.questrail.cot.codec.impl.DefaultCotFrameDecoder;
import com.questrail.cot.codec.impl.DefaultCotFrameEncoder;
import com.questrail.cot.codec.impl.TakPayloadCodecs;
import com.questrail.cot.config.CotClientConfig;
import com.questrail.cot.model.CotEvents;
import com.questrail.cot.model.CotPayload;
import com.questrail.cot.observability.CotErrorEvent;
import com.questrail.cot.observability.CotObservabilitySink;
import com.questrail.cot.observability.Slf4jCotObservabilitySink;
import com.questrail.cot.prefs.PreferencePackageImporter;
import com.questrail.cot.time.SystemWallClock;
import com.questrail.cot.time.WallClock;
import com.questrail.cot.transport.ChannelPair;
import com.questrail.cot.transport.ChannelReader;
import com.questrail.cot.transport.Destination;
import com.questrail.cot.transport.TransportResolver;
import com.questrail.cot.transport.netty.NettyTransportResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * CotClientRuntime
 * =============================================================================
 * Composition root and lifecycle owner for a CoT client.
 *
 * <h2>Wiring</h2>
 * For each destination the runtime owns one outbound and one inbound
 * {@link EventQueue}. On {@link #start()} it resolves the destination to a
 * {@link ChannelPair} and binds a {@link TransmitWorker} to the outbound queue and,
 * unless the destination is write-only, a {@link ReceiveWorker} to the inbound
 * queue. Application workers registered with {@link Builder#addWorker(Worker)} run
 * alongside them.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   runtime.start()   resolves channels, starts every worker
 *   runtime.run()     blocks until the first worker ends, then stops the rest
 *   runtime.stop()    stops workers, closes channels (safe from any thread)
 * </pre>
 * A failed worker ends the run and its exception is rethrown from {@link #run()}.
 * Nothing is retried or reconnected; restart policy belongs to the caller.
 *
 * <h2>Observability</h2>
 * Events go to {@link Slf4jCotObservabilitySink} unless another sink is supplied.
 *
 * <h2>Greeting</h2>
 * Unless {@code NO_HELLO} is set, a hello event carrying {@code COT_HOST_ID} and
 * going stale after {@code COT_STALE} is placed on each outbound queue when the
 * runtime is built, ahead of anything the application enqueues.
 */
public final class CotClientRuntime
{
    private static final Logger log = LoggerFactory.getLogger(CotClientRuntime.class);

    private final List<Link> links;
    private final List<Worker> applicationWorkers;
    private final TransportResolver resolver;
    private final CotFrameEncoder encoder;
    private final CotFrameDecoder decoder;
    private final CotObservabilitySink observabilitySink;

    private final Object lifecycleLock = new Object();
    private final List<Worker> workers = new ArrayList<>();
    private ExecutorService executor;
    private ExecutorCompletionService<Worker> completion;
    private volatile boolean started;
    private volatile boolean stopped;

    private CotClientRuntime(Builder b,
                             List<Link> links,
                             TransportResolver resolver,
                             CotFrameEncoder encoder,
                             CotFrameDecoder decoder)
    {
        this.links = links;
        this.applicationWorkers = List.copyOf(b.workers);
        this.resolver = resolver;
        this.encoder = encoder;
        this.decoder = decoder;
        this.observabilitySink = b.observabilitySink;
    }

    /**
     * Resolves every destination and starts all workers. Returns without waiting.
     *
     * @throws com.questrail.cot.transport.TransportException if a destination cannot
     *         be resolved; channels already opened are closed again
     * @throws com.questrail.cot.tls.TlsException if a TLS destination cannot be set up
     * @throws IllegalStateException if already started or stopped
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (started || stopped) {
                throw new IllegalStateException(stopped ? "Runtime already stopped" : "Runtime already started");
            }
            started = true;

            try {
                for (Link link : links) {
                    link.channel = resolver.resolve(link.destination, link.config);
                    log.info("Opened {}", link.destination);
                    workers.addAll(workersFor(link));
                }
            } catch (RuntimeException e) {
                closeChannels();
                stopped = true;
                throw e;
            }
            workers.addAll(applicationWorkers);

            executor = Executors.newFixedThreadPool(workers.size(), new WorkerThreadFactory());
            completion = new ExecutorCompletionService<>(executor);
            for (Worker worker : workers) {
                completion.submit(worker, worker);
            }
            log.debug("Started {} workers", workers.size());
        }
    }

    /**
     * Starts the runtime if needed, then blocks until any worker ends.
     *
     * <p>Returns normally when a worker finished on its own or {@link #stop()} was
     * called. When a worker failed, the remaining workers are stopped and the
     * failure is rethrown.</p>
     *
     * @throws com.questrail.cot.transport.ChannelIOException if a channel read or
     *         write failed
     */
    public void run() {
        if (!started) {
            start();
        }
        Throwable failure = null;
        try {
            Future<Worker> first = completion.take();
            Worker worker = first.get();
            log.debug("Worker {} finished", worker.name());
        } catch (ExecutionException e) {
            failure = e.getCause();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            stop();
        }

        if (failure instanceof RuntimeException) {
            throw (RuntimeException) failure;
        }
        if (failure instanceof Error) {
            throw (Error) failure;
        }
        if (failure != null) {
            throw new CotClientException("Worker failed", failure);
        }
    }

    /**
     * Stops every worker and closes every channel. Idempotent. In-flight writes may
     * not complete.
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (stopped) {
                return;
            }
            stopped = true;

            for (Worker worker : workers) {
                worker.stop();
            }
            closeChannels();

            if (executor != null) {
                executor.shutdown();
                try {
                    if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                        executor.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    executor.shutdownNow();
                    Thread.currentThread().interrupt();
                }
            }
        }
    }

    public boolean isRunning() {
        return started && !stopped;
    }

    /** Outbound queue of the first destination. */
    public EventQueue<CotPayload> txQueue() {
        return links.get(0).txQueue;
    }

    /** Inbound queue of the first destination. */
    public EventQueue<CotPayload> rxQueue() {
        return links.get(0).rxQueue;
    }

    public List<Link> links() {
        return Collections.unmodifiableList(links);
    }

    /** Workers created by {@link #start()}, followed by the application workers. */
    public List<Worker> workers() {
        synchronized (lifecycleLock) {
            return List.copyOf(workers);
        }
    }

    private List<Worker> workersFor(Link link) {
        List<Worker> result = new ArrayList<>(2);
        String label = link.destination.toString();
        result.add(new TransmitWorker(
                "tx " + label,
                link.txQueue,
                link.channel.writer(),
                encoder,
                link.version,
                link.variant,
                link.pacing,
                observabilitySink));

        Optional<ChannelReader> reader = link.channel.reader();
        if (reader.isPresent()) {
            FramedChannelReader framed = new FramedChannelReader(
                    reader.get(),
                    link.channel.streamOriented() ? new AutoDetectingStreamFramer(link.config.maxFrameLength()) : null,
                    observabilitySink);
            result.add(new ReceiveWorker("rx " + label, framed, link.rxQueue, decoder, link.version, observabilitySink));
        }
        return result;
    }

    private void closeChannels() {
        for (Link link : links) {
            ChannelPair channel = link.channel;
            if (channel == null) {
                continue;
            }
            try {
                channel.close();
            } catch (RuntimeException e) {
                observabilitySink.onError(new CotErrorEvent(Instant.now(), "Failed to close " + link.destination, e));
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * One destination with its queues and, once started, its channel.
     */
    public static final class Link {
        private final CotClientConfig config;
        private final Destination destination;
        private final ProtocolVersion version;
        private final TakProtoVariant variant;
        private final PacingPolicy pacing;
        private final EventQueue<CotPayload> txQueue;
        private final EventQueue<CotPayload> rxQueue;
        private volatile ChannelPair channel;

        private Link(CotClientConfig config,
                     EventQueue<CotPayload> txQueue,
                     EventQueue<CotPayload> rxQueue,
                     PacingPolicy pacing)
        {
            this.config = config;
            this.destination = Destination.parse(config.cotUrl());
            this.version = ProtocolVersion.of(config.takProto());
            this.variant = TakProtoVariant.forDestination(destination.isMulticastLiteral());
            this.pacing = pacing;
            this.txQueue = txQueue;
            this.rxQueue = rxQueue;
        }

        /** Effective configuration, after any preference package was merged in. */
        public CotClientConfig config() {
            return config;
        }

        public Destination destination() {
            return destination;
        }

        public ProtocolVersion version() {
            return version;
        }

        public EventQueue<CotPayload> txQueue() {
            return txQueue;
        }

        public EventQueue<CotPayload> rxQueue() {
            return rxQueue;
        }

        /** Empty until the runtime has been started. */
        public Optional<ChannelPair> channel() {
            return Optional.ofNullable(channel);
        }
    }

    public static final class Builder {
        private final List<DestinationSpec> destinations = new ArrayList<>();
        private final List<Worker> workers = new ArrayList<>();
        private CotObservabilitySink observabilitySink = new Slf4jCotObservabilitySink();
        private TransportResolver resolver;
        private CotFrameEncoder encoder;
        private CotFrameDecoder decoder;
        private TakPayloadCodec takPayloadCodec;
        private PreferencePackageImporter preferenceImporter;
        private PacingPolicy pacing;
        private WallClock clock = SystemWallClock.INSTANCE;

        /**
         * Adds a destination with queues sized from its configuration. The first
         * destination added backs {@link #txQueue()} and {@link #rxQueue()}.
         */
        public Builder addDestination(CotClientConfig config) {
            destinations.add(new DestinationSpec(Objects.requireNonNull(config, "config"), null, null));
            return this;
        }

        /**
         * Destination bound to caller-supplied queues, for example
         * {@link PollingEventQueue} adapters onto a queue shared with another process.
         */
        public Builder addDestination(CotClientConfig config, EventQueue<CotPayload> txQueue, EventQueue<CotPayload> rxQueue) {
            destinations.add(new DestinationSpec(
                    Objects.requireNonNull(config, "config"),
                    Objects.requireNonNull(txQueue, "txQueue"),
                    Objects.requireNonNull(rxQueue, "rxQueue")));
            return this;
        }

        public Builder addWorker(Worker worker) {
            workers.add(Objects.requireNonNull(worker, "worker"));
            return this;
        }

        public Builder withObservabilitySink(CotObservabilitySink sink) {
            this.observabilitySink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        public Builder withResolver(TransportResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        public Builder withEncoder(CotFrameEncoder encoder) {
            this.encoder = encoder;
            return this;
        }

        public Builder withDecoder(CotFrameDecoder decoder) {
            this.decoder = decoder;
            return this;
        }

        /**
         * Binary payload codec for the default encoder and decoder. When unset, one is
         * looked up with {@link java.util.ServiceLoader}.
         */
        public Builder withTakPayloadCodec(TakPayloadCodec codec) {
            this.takPayloadCodec = codec;
            return this;
        }

        public Builder withPreferenceImporter(PreferencePackageImporter importer) {
            this.preferenceImporter = importer;
            return this;
        }

        /** Overrides the pacing derived from each destination's configuration. */
        public Builder withPacing(PacingPolicy pacing) {
            this.pacing = pacing;
            return this;
        }

        public Builder withClock(WallClock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * Without any destination, the runtime uses {@link CotClientConfig#defaults()}.
         *
         * @throws com.questrail.cot.transport.TransportException if a destination URL
         *         is malformed or names an unknown scheme
         * @throws IllegalArgumentException if a protocol version is unsupported
         * @throws com.questrail.cot.prefs.PreferencePackageException if a configured
         *         preference package cannot be imported
         */
        public CotClientRuntime build() {
            if (destinations.isEmpty()) {
                destinations.add(new DestinationSpec(CotClientConfig.defaults(), null, null));
            }

            // 1. Codecs
            TakPayloadCodec codec = takPayloadCodec != null ? takPayloadCodec : TakPayloadCodecs.discover().orElse(null);
            CotFrameEncoder enc = encoder != null ? encoder : new DefaultCotFrameEncoder(codec);
            CotFrameDecoder dec = decoder != null ? decoder : new DefaultCotFrameDecoder(codec);
            TransportResolver res = resolver != null ? resolver : new NettyTransportResolver(observabilitySink);

            // 2. Destinations, with preference packages merged in
            List<Link> links = new ArrayList<>(destinations.size());
            for (DestinationSpec spec : destinations) {
                CotClientConfig config = withPreferencePackage(spec.config);
                EventQueue<CotPayload> tx = spec.txQueue != null
                        ? spec.txQueue
                        : new InProcessEventQueue<>(config.maxOutQueue(), observabilitySink);
                EventQueue<CotPayload> rx = spec.rxQueue != null
                        ? spec.rxQueue
                        : new InProcessEventQueue<>(config.maxInQueue(), observabilitySink);
                Link link = new Link(config, tx, rx, pacing != null ? pacing : PacingPolicy.fromConfig(config));

                // 3. Greeting goes first
                if (!config.helloSuppressed()) {
                    tx.put(CotEvents.hello(config.hostId().orElse(null), config.staleAfter(), clock));
                }
                links.add(link);
            }
            return new CotClientRuntime(this, List.copyOf(links), res, enc, dec);
        }

        private CotClientConfig withPreferencePackage(CotClientConfig config) {
            Optional<Path> pref = config.preferencePackage();
            if (pref.isEmpty()) {
                return config;
            }
            PreferencePackageImporter importer = preferenceImporter != null ? preferenceImporter : new PreferencePackageImporter();
            return importer.importPackage(pref.get()).mergeInto(config);
        }
    }

    private record DestinationSpec(CotClientConfig config, EventQueue<CotPayload> txQueue, EventQueue<CotPayload> rxQueue) {
    }

    private static final class WorkerThreadFactory implements java.util.concurrent.ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "cot-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
