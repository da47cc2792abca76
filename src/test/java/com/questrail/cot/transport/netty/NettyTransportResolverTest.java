package com.questrail.cot.transport.netty;

import com.questrail.cot.config.CotClientConfig;
import com.questrail.cot.observability.CotSecurityWarning;
import com.questrail.cot.observability.CotTransportEvent;
import com.questrail.cot.observability.RecordingObservabilitySink;
import com.questrail.cot.tls.ClientCertificateException;
import com.questrail.cot.transport.AddressException;
import com.questrail.cot.transport.ChannelIOException;
import com.questrail.cot.transport.ChannelPair;
import com.questrail.cot.transport.ChannelReader;
import com.questrail.cot.transport.Destination;
import com.questrail.cot.transport.SocketBindException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.MulticastSocket;
import java.net.NetworkInterface;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class NettyTransportResolverTest
{
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final NettyTransportResolver resolver = new NettyTransportResolver(sink);
    private final CotClientConfig config = CotClientConfig.defaults();

    private ChannelPair resolve(String url) {
        return resolver.resolve(Destination.parse(url), config);
    }

    // ---------------------------------------------------------------------
    // TCP
    // ---------------------------------------------------------------------

    @Test
    void tcpCarriesBytesBothWays() throws Exception {
        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            ChannelPair pair = resolve("tcp://127.0.0.1:" + server.getLocalPort());
            try (Socket peer = server.accept()) {
                peer.setSoTimeout(5000);
                byte[] sent = "<event uid=\"a\"></event>".getBytes(StandardCharsets.UTF_8);
                pair.writer().write(sent);

                byte[] received = peer.getInputStream().readNBytes(sent.length);
                assertArrayEquals(sent, received);

                peer.getOutputStream().write("pong".getBytes(StandardCharsets.UTF_8));
                peer.getOutputStream().flush();
                assertEquals("pong", readAtLeast(pair.reader().orElseThrow(), 4));
            } finally {
                pair.close();
            }
            assertTrue(pair.streamOriented());
            assertTrue(sink.eventsOfType(CotTransportEvent.class).stream()
                    .anyMatch(e -> e.kind() == CotTransportEvent.Kind.OPENED));
        }
    }

    @Test
    void peerCloseSurfacesAsChannelError() throws Exception {
        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            ChannelPair pair = resolve("tcp://127.0.0.1:" + server.getLocalPort());
            server.accept().close();

            ChannelReader reader = pair.reader().orElseThrow();
            assertThrows(ChannelIOException.class, () -> {
                for (int i = 0; i < 50; i++) {
                    reader.read(Duration.ofMillis(100));
                }
            });
            pair.close();
        }
    }

    @Test
    void refusedConnectionIsAnAddressError() throws Exception {
        int port;
        try (ServerSocket probe = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = probe.getLocalPort();
        }
        assertThrows(AddressException.class, () -> resolve("tcp://127.0.0.1:" + port));
    }

    @Test
    void unresolvableHostIsAnAddressError() {
        assertThrows(AddressException.class, () -> resolve("tcp://no-such-host.invalid:8087"));
    }

    @Test
    void tlsWithoutCertificateFailsBeforeConnecting() {
        assertThrows(ClientCertificateException.class, () -> resolve("tls://127.0.0.1:1"));
    }

    // ---------------------------------------------------------------------
    // UDP
    // ---------------------------------------------------------------------

    @Test
    void writeOnlyMulticastHasNoReader() {
        ChannelPair pair = resolve("udp+wo://239.2.3.1:6969");
        try {
            assertTrue(pair.reader().isEmpty());
            assertFalse(pair.streamOriented());
        } finally {
            pair.close();
        }
    }

    @Test
    void deprecatedMulticastModifierIsReported() {
        ChannelPair pair = resolve("udp+multicast+wo://239.2.3.1:6969");
        pair.close();

        assertTrue(sink.hasEventOfType(CotSecurityWarning.class));
    }

    @Test
    void unicastUdpSendsAndReceivesDatagrams() throws Exception {
        try (DatagramSocket peer = new DatagramSocket(0, InetAddress.getLoopbackAddress())) {
            peer.setSoTimeout(5000);
            ChannelPair pair = resolve("udp://127.0.0.1:" + peer.getLocalPort());
            try {
                pair.writer().write("ping".getBytes(StandardCharsets.UTF_8));

                DatagramPacket in = new DatagramPacket(new byte[64], 64);
                peer.receive(in);
                assertEquals("ping", new String(in.getData(), 0, in.getLength(), StandardCharsets.UTF_8));

                byte[] reply = "pong".getBytes(StandardCharsets.UTF_8);
                peer.send(new DatagramPacket(reply, reply.length, in.getSocketAddress()));

                Optional<byte[]> got = pair.reader().orElseThrow().read(Duration.ofSeconds(5));
                assertArrayEquals(reply, got.orElseThrow());
            } finally {
                pair.close();
            }
        }
    }

    @Test
    void closedDatagramChannelRejectsWrites() {
        ChannelPair pair = resolve("udp+wo://127.0.0.1:9");
        pair.close();

        assertThrows(ChannelIOException.class, () -> pair.writer().write(new byte[] {1}));
    }

    @Test
    void multicastTtlAndInterfaceAreApplied() {
        CotClientConfig ttl7 = CotClientConfig.builder().withMulticastTtl(7).build();
        ChannelPair pair = resolver.resolve(Destination.parse("udp+wo://239.2.3.1:6969"), ttl7);
        try {
            NettyDatagramChannel channel = (NettyDatagramChannel) pair.writer();
            NetworkInterface expected = MulticastInterfaces.select(
                    ttl7.multicastLocalAddress(), groupAddress("239.2.3.1"));

            assertEquals(7, channel.socketConfig().getTimeToLive());
            assertEquals(expected, channel.socketConfig().getNetworkInterface());
        } finally {
            pair.close();
        }
    }

    @Test
    void readWriteMulticastReceivesGroupTraffic() throws Exception {
        String group = "239.255.42.99";
        int port = freeUdpPort();
        NetworkInterface ni = MulticastInterfaces.select(config.multicastLocalAddress(), groupAddress(group));
        assumeTrue(hostDeliversMulticast(groupAddress(group), port, ni),
                "host does not loop multicast back on " + ni.getName());

        ChannelPair sender = resolve("udp://" + group + ":" + port);
        ChannelPair receiver = resolve("udp://" + group + ":" + port);
        try {
            assertEquals(port, ((NettyDatagramChannel) sender.writer()).localAddress().getPort());
            assertEquals(port, ((NettyDatagramChannel) receiver.writer()).localAddress().getPort());

            byte[] sent = "<event uid=\"group\"></event>".getBytes(StandardCharsets.UTF_8);
            sender.writer().write(sent);

            assertArrayEquals(sent, readDatagram(receiver.reader().orElseThrow()));
        } finally {
            sender.close();
            receiver.close();
        }
    }

    @Test
    void broadcastBindsDestinationPortAndEnablesBroadcast() {
        int port = freeUdpPort();
        ChannelPair pair = resolve("udp+broadcast://127.0.0.1:" + port);
        try {
            NettyDatagramChannel channel = (NettyDatagramChannel) pair.writer();
            assertTrue(channel.socketConfig().isBroadcast());
            assertEquals(port, channel.localAddress().getPort());

            // Bound on the destination port, so our own datagram comes back to us.
            byte[] beacon = "beacon".getBytes(StandardCharsets.UTF_8);
            pair.writer().write(beacon);

            assertArrayEquals(beacon, readDatagram(pair.reader().orElseThrow()));
        } finally {
            pair.close();
        }
    }

    @Test
    void writeOnlyBroadcastUsesEphemeralPort() throws Exception {
        try (DatagramSocket peer = new DatagramSocket(0, InetAddress.getLoopbackAddress())) {
            peer.setSoTimeout(5000);
            ChannelPair pair = resolve("udp+broadcast+wo://127.0.0.1:" + peer.getLocalPort());
            try {
                NettyDatagramChannel channel = (NettyDatagramChannel) pair.writer();
                assertTrue(pair.reader().isEmpty());
                assertTrue(channel.socketConfig().isBroadcast());
                assertNotEquals(peer.getLocalPort(), channel.localAddress().getPort());

                pair.writer().write("ping".getBytes(StandardCharsets.UTF_8));
                DatagramPacket in = new DatagramPacket(new byte[64], 64);
                peer.receive(in);
                assertEquals("ping", new String(in.getData(), 0, in.getLength(), StandardCharsets.UTF_8));
            } finally {
                pair.close();
            }
        }
    }

    @Test
    void unresolvableMulticastLocalAddressIsABindError() {
        CotClientConfig bad = CotClientConfig.builder().withMulticastLocalAddress("no-such-host.invalid").build();

        assertThrows(SocketBindException.class,
                () -> resolver.resolve(Destination.parse("udp://239.2.3.1:6969"), bad));
    }

    @Test
    void outOfRangeMulticastTtlIsABindError() {
        CotClientConfig bad = CotClientConfig.builder().withMulticastTtl(300).build();

        assertThrows(SocketBindException.class,
                () -> resolver.resolve(Destination.parse("udp+wo://239.2.3.1:6969"), bad));
    }

    // ---------------------------------------------------------------------
    // Sinks
    // ---------------------------------------------------------------------

    @Test
    void logSchemeIsWriterOnly() {
        ChannelPair pair = resolve("log:stderr");
        assertTrue(pair.reader().isEmpty());
        pair.close();
    }

    private static byte[] readDatagram(ChannelReader reader) {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (System.nanoTime() < deadline) {
            Optional<byte[]> got = reader.read(Duration.ofMillis(200));
            if (got.isPresent()) {
                return got.get();
            }
        }
        return fail("no datagram within 5s");
    }

    private static int freeUdpPort() {
        try (DatagramSocket s = new DatagramSocket(0)) {
            return s.getLocalPort();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static InetAddress groupAddress(String literal) {
        try {
            return InetAddress.getByName(literal);
        } catch (UnknownHostException e) {
            throw new IllegalStateException(e);
        }
    }

    /**
     * Sends one datagram to {@code group} with plain JDK sockets on {@code ni} and
     * reports whether it looped back, so hosts without multicast routing skip.
     */
    private static boolean hostDeliversMulticast(InetAddress group, int port, NetworkInterface ni) {
        try (MulticastSocket rx = new MulticastSocket(port); MulticastSocket tx = new MulticastSocket()) {
            rx.joinGroup(new InetSocketAddress(group, port), ni);
            rx.setSoTimeout(1000);
            tx.setNetworkInterface(ni);
            byte[] check = {1};
            tx.send(new DatagramPacket(check, check.length, group, port));
            rx.receive(new DatagramPacket(new byte[8], 8));
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    private static String readAtLeast(ChannelReader reader, int length) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (out.size() < length && System.nanoTime() < deadline) {
            reader.read(Duration.ofMillis(200)).ifPresent(b -> out.write(b, 0, b.length));
        }
        return out.toString(StandardCharsets.UTF_8);
    }
}
