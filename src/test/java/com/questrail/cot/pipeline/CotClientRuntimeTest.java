package com.questrail.cot.pipeline;

import com.questrail.cot.codec.ProtocolVersion;
import com.questrail.cot.codec.TakProtoVariant;
import com.questrail.cot.codec.impl.DefaultCotFrameEncoder;
import com.questrail.cot.config.ConfigKeys;
import com.questrail.cot.config.CotClientConfig;
import com.questrail.cot.model.CotEvent;
import com.questrail.cot.model.CotEvents;
import com.questrail.cot.model.CotPayload;
import com.questrail.cot.model.CotPoint;
import com.questrail.cot.observability.RecordingObservabilitySink;
import com.questrail.cot.prefs.PreferencePackageImporter;
import com.questrail.cot.time.ManualWallClock;
import com.questrail.cot.transport.AddressException;
import com.questrail.cot.transport.ChannelIOException;
import com.questrail.cot.transport.ChannelPair;
import com.questrail.cot.transport.Destination;
import com.questrail.cot.transport.FakeChannelReader;
import com.questrail.cot.transport.FakeChannelWriter;
import com.questrail.cot.transport.TransportResolver;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.junit.jupiter.api.Assertions.*;

class CotClientRuntimeTest
{
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final ManualWallClock clock = new ManualWallClock(Instant.parse("2024-05-01T12:00:00Z"));

    @TempDir
    Path dir;

    // ---------------------------------------------------------------------
    // End to end over TCP
    // ---------------------------------------------------------------------

    @Test
    void queuedEventReachesTcpListenerAndRepliesComeBack() throws Exception {
        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            CotClientConfig config = CotClientConfig.builder()
                    .withCotUrl("tcp://127.0.0.1:" + server.getLocalPort())
                    .withHelloSuppressed(true)
                    .build();
            CotClientRuntime runtime = CotClientRuntime.builder()
                    .addDestination(config)
                    .withObservabilitySink(sink)
                    .withClock(clock)
                    .build();

            CotEvent event = CotEvents.event("e2e-1", CotPoint.of(38.9, -77.0), null, "ALPHA", clock);
            byte[] expected = new DefaultCotFrameEncoder().encode(event, ProtocolVersion.V0_XML, TakProtoVariant.STREAM);

            runtime.start();
            try (Socket peer = server.accept()) {
                peer.setSoTimeout(5000);
                runtime.txQueue().put(event);

                byte[] received = readEvent(peer.getInputStream());
                assertArrayEquals(expected, received);
                assertTrue(new String(received, StandardCharsets.UTF_8).endsWith("</event>"));

                OutputStream out = peer.getOutputStream();
                out.write(expected);
                out.flush();
                CotPayload reply = runtime.rxQueue().poll(Duration.ofSeconds(5)).orElseThrow();
                assertEquals("e2e-1", ((CotEvent) reply).uid());
            } finally {
                runtime.stop();
            }
            assertFalse(runtime.isRunning());
            assertTrue(runtime.links().get(0).channel().orElseThrow().isClosed());
        }
    }

    // ---------------------------------------------------------------------
    // Wiring with fake channels
    // ---------------------------------------------------------------------

    @Test
    void helloIsSentBeforeApplicationEvents() throws Exception {
        FakeResolver resolver = new FakeResolver();
        CotClientRuntime runtime = CotClientRuntime.builder()
                .addDestination(CotClientConfig.builder().withCotUrl("tcp://tak.example:8087").withHostId("unit-1").build())
                .withResolver(resolver)
                .withObservabilitySink(sink)
                .withClock(clock)
                .build();
        runtime.txQueue().put(CotEvents.event("app-1", null, null, null, clock));

        resolver.writer.expectWrites(2);
        runtime.start();
        try {
            assertTrue(resolver.writer.awaitWrites(5, TimeUnit.SECONDS));
        } finally {
            runtime.stop();
        }

        List<byte[]> written = resolver.writer.written();
        String hello = new String(written.get(0), StandardCharsets.UTF_8);
        assertTrue(hello.contains("uid=\"unit-1\""));
        assertTrue(hello.contains("type=\"" + CotEvents.TASKING_TYPE + "\""));
        assertTrue(new String(written.get(1), StandardCharsets.UTF_8).contains("uid=\"app-1\""));
    }

    @Test
    void helloUsesConfiguredStaleTime() {
        CotClientRuntime runtime = CotClientRuntime.builder()
                .addDestination(CotClientConfig.builder().withCotUrl("tcp://tak.example:8087")
                        .set(ConfigKeys.COT_STALE, "300").build())
                .withResolver(new FakeResolver())
                .withClock(clock)
                .build();

        CotEvent hello = (CotEvent) runtime.txQueue().poll(Duration.ZERO).orElseThrow();
        assertEquals(Duration.ofSeconds(300), Duration.between(hello.time(), hello.stale()));
    }

    @Test
    void noHelloLeavesQueueEmpty() {
        CotClientRuntime runtime = CotClientRuntime.builder()
                .addDestination(CotClientConfig.builder().withCotUrl("tcp://tak.example:8087").withHelloSuppressed(true).build())
                .withResolver(new FakeResolver())
                .build();
        assertEquals(0, runtime.txQueue().size());
    }

    @Test
    void queuesAreSizedFromConfiguration() {
        CotClientRuntime runtime = CotClientRuntime.builder()
                .addDestination(CotClientConfig.builder()
                        .withCotUrl("tcp://tak.example:8087")
                        .withMaxOutQueue(7)
                        .withMaxInQueue(9)
                        .build())
                .withResolver(new FakeResolver())
                .build();
        assertEquals(7, runtime.txQueue().capacity());
        assertEquals(9, runtime.rxQueue().capacity());
    }

    @Test
    void defaultsToMulticastDestination() {
        CotClientRuntime runtime = CotClientRuntime.builder().withResolver(new FakeResolver()).build();
        Destination destination = runtime.links().get(0).destination();
        assertEquals(Destination.parse(ConfigKeys.DEFAULT_COT_URL), destination);
        assertTrue(destination.isWriteOnly());
    }

    @Test
    void writeFailurePropagatesFromRun() {
        FakeResolver resolver = new FakeResolver();
        resolver.writer.failFromNowOn();
        CotClientRuntime runtime = CotClientRuntime.builder()
                .addDestination(CotClientConfig.builder().withCotUrl("tcp://tak.example:8087").build())
                .withResolver(resolver)
                .withObservabilitySink(sink)
                .build();

        assertThrows(ChannelIOException.class, runtime::run);
        assertFalse(runtime.isRunning());
        assertTrue(resolver.opened.get(0).isClosed());
    }

    @Test
    void stopFromAnotherThreadEndsRun() throws Exception {
        FakeResolver resolver = new FakeResolver();
        CotClientRuntime runtime = CotClientRuntime.builder()
                .addDestination(CotClientConfig.builder().withCotUrl("tcp://tak.example:8087").withHelloSuppressed(true).build())
                .withResolver(resolver)
                .build();

        CompletableFuture<Void> running = CompletableFuture.runAsync(runtime::run);
        while (!runtime.isRunning()) {
            Thread.sleep(5);
        }
        assertEquals(2, runtime.workers().size());

        runtime.stop();
        running.get(10, TimeUnit.SECONDS);
        for (Worker worker : runtime.workers()) {
            assertTrue(worker.isStopRequested());
        }
    }

    @Test
    void applicationWorkerFinishingEndsRun() {
        Worker oneShot = new Worker("app", null) {
            @Override
            protected void runOnce() {
                stop();
            }
        };
        CotClientRuntime runtime = CotClientRuntime.builder()
                .addDestination(CotClientConfig.builder().withCotUrl("tcp://tak.example:8087").withHelloSuppressed(true).build())
                .withResolver(new FakeResolver())
                .addWorker(oneShot)
                .build();

        runtime.run();

        assertEquals(WorkerState.STOPPED, oneShot.state());
        assertFalse(runtime.isRunning());
    }

    @Test
    void failedResolveClosesChannelsAlreadyOpened() {
        FakeResolver resolver = new FakeResolver();
        CotClientRuntime runtime = CotClientRuntime.builder()
                .addDestination(CotClientConfig.builder().withCotUrl("tcp://tak.example:8087").build())
                .addDestination(CotClientConfig.builder().withCotUrl("tcp://unreachable.invalid:8087").build())
                .withResolver(resolver)
                .build();

        assertThrows(AddressException.class, runtime::start);
        assertEquals(1, resolver.opened.size());
        assertTrue(resolver.opened.get(0).isClosed());
        assertThrows(IllegalStateException.class, runtime::start);
    }

    @Test
    void startTwiceIsRejected() {
        CotClientRuntime runtime = CotClientRuntime.builder()
                .addDestination(CotClientConfig.builder().withCotUrl("tcp://tak.example:8087").build())
                .withResolver(new FakeResolver())
                .build();
        runtime.start();
        try {
            assertThrows(IllegalStateException.class, runtime::start);
        } finally {
            runtime.stop();
        }
        runtime.stop();
    }

    @Test
    void preferencePackageIsMergedAtBuild() throws Exception {
        Path archive = dir.resolve("client.zip");
        try (OutputStream out = Files.newOutputStream(archive);
             ZipOutputStream zip = new ZipOutputStream(out)) {
            zip.putNextEntry(new ZipEntry("settings.ini"));
            zip.write("COT_URL=tcp://from-package:8087\nCOT_HOST_ID=pkg-host\n".getBytes(StandardCharsets.UTF_8));
            zip.closeEntry();
        }
        CotClientConfig config = CotClientConfig.builder()
                .set(ConfigKeys.PREF_PACKAGE, archive.toString())
                .set(ConfigKeys.COT_URL, "tcp://explicit:8087")
                .build();

        CotClientRuntime runtime = CotClientRuntime.builder()
                .addDestination(config)
                .withResolver(new FakeResolver())
                .withPreferenceImporter(new PreferencePackageImporter(dir.resolve("work")))
                .withClock(clock)
                .build();

        CotClientRuntime.Link link = runtime.links().get(0);
        assertEquals("explicit", link.destination().host());
        assertEquals("pkg-host", link.config().hostId().orElseThrow());
        CotEvent hello = (CotEvent) runtime.txQueue().poll(Duration.ZERO).orElseThrow();
        assertEquals("pkg-host", hello.uid());
    }

    @Test
    void callerSuppliedQueuesAreUsed() {
        InProcessEventQueue<CotPayload> tx = new InProcessEventQueue<>(0);
        InProcessEventQueue<CotPayload> rx = new InProcessEventQueue<>(0);
        CotClientRuntime runtime = CotClientRuntime.builder()
                .addDestination(CotClientConfig.builder().withCotUrl("tcp://tak.example:8087").build(), tx, rx)
                .withResolver(new FakeResolver())
                .build();

        assertSame(tx, runtime.txQueue());
        assertSame(rx, runtime.rxQueue());
        assertEquals(1, tx.size());
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    /** Hands out fake channels; hosts ending in {@code .invalid} fail to resolve. */
    private static final class FakeResolver implements TransportResolver {
        final FakeChannelWriter writer = new FakeChannelWriter();
        final List<ChannelPair> opened = new ArrayList<>();

        @Override
        public synchronized ChannelPair resolve(Destination destination, CotClientConfig config) {
            if (destination.host().endsWith(".invalid")) {
                throw new AddressException("Cannot resolve " + destination.host());
            }
            FakeChannelReader reader = new FakeChannelReader();
            ChannelPair pair = new ChannelPair(destination, destination.isWriteOnly() ? null : reader, writer, reader::close);
            opened.add(pair);
            return pair;
        }
    }

    private static byte[] readEvent(InputStream in) throws Exception {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        int b;
        while ((b = in.read()) != -1) {
            buffer.write(b);
            if (buffer.toString(StandardCharsets.UTF_8).endsWith("</event>")) {
                break;
            }
        }
        return buffer.toByteArray();
    }
}
