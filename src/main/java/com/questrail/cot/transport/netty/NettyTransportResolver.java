package com.questrail.cot.transport.netty;

import com.questrail.cot.config.CotClientConfig;
import com.questrail.cot.config.IpFamily;
import com.questrail.cot.observability.CotObservabilitySink;
import com.questrail.cot.observability.CotSecurityWarning;
import com.questrail.cot.tls.TlsClientBuilder;
import com.questrail.cot.tls.TlsIdentity;
import com.questrail.cot.transport.AddressException;
import com.questrail.cot.transport.ChannelPair;
import com.questrail.cot.transport.Destination;
import com.questrail.cot.transport.SocketBindException;
import com.questrail.cot.transport.TransportResolver;
import com.questrail.cot.transport.UnsupportedSchemeException;
import com.questrail.cot.transport.sink.SinkChannels;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.time.Instant;
import java.util.Objects;

/**
 * NettyTransportResolver
 * =============================================================================
 * Production {@link TransportResolver}: Netty sockets for network schemes, plain
 * streams for {@code log} and {@code file}.
 *
 * <h2>Scheme handling</h2>
 * <ul>
 *   <li>{@code tcp}: connected stream.</li>
 *   <li>{@code tls}: connected stream upgraded by {@link TlsClientBuilder} using
 *       {@link TlsIdentity#fromConfig}.</li>
 *   <li>{@code udp}: see {@link NettyDatagramChannel} for the socket variants.</li>
 *   <li>{@code log}, {@code file}: writer-only sinks.</li>
 * </ul>
 *
 * <p>Host names are resolved here, preferring the configured {@code IP_FAMILY}.
 * Each channel gets its own single-threaded event loop which is shut down when the
 * channel pair is closed.</p>
 */
public final class NettyTransportResolver implements TransportResolver
{
    private final CotObservabilitySink sink;
    private final TlsClientBuilder tls;

    public NettyTransportResolver(CotObservabilitySink sink)
    {
        this(sink, new TlsClientBuilder(sink));
    }

    public NettyTransportResolver(CotObservabilitySink sink, TlsClientBuilder tls)
    {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.tls = Objects.requireNonNull(tls, "tls");
    }

    @Override
    public ChannelPair resolve(Destination destination, CotClientConfig config)
    {
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(config, "config");

        switch (destination.scheme()) {
            case LOG:
            case FILE:
                return SinkChannels.open(destination, sink);
            case TCP:
                return connect(destination, config).toChannelPair();
            case TLS: {
                // Checked before connecting so a bad configuration never opens a socket.
                TlsIdentity identity = TlsIdentity.fromConfig(config);
                NettyStreamChannel tcp = connect(destination, config);
                return tls.wrap(tcp, destination.host(), identity);
            }
            case UDP: {
                if (destination.usesDeprecatedMulticastModifier()) {
                    sink.onSecurityWarning(new CotSecurityWarning(Instant.now(),
                            "The udp+multicast scheme is deprecated; multicast is detected from the address: " + destination));
                }
                InetSocketAddress remote = new InetSocketAddress(
                        resolveHost(destination.host(), config.ipFamily()), destination.port());
                InetAddress local;
                int ttl;
                try {
                    local = config.multicastLocalAddress();
                    ttl = config.multicastTtl();
                } catch (IllegalArgumentException e) {
                    throw new SocketBindException(e.getMessage(), e);
                }
                return NettyDatagramChannel.open(destination, remote, local, ttl, sink);
            }
            default:
                throw new UnsupportedSchemeException("No transport for scheme " + destination.scheme());
        }
    }

    private NettyStreamChannel connect(Destination destination, CotClientConfig config)
    {
        InetSocketAddress remote = new InetSocketAddress(
                resolveHost(destination.host(), config.ipFamily()), destination.port());
        return NettyStreamChannel.connect(destination, remote, config.connectTimeout(), sink);
    }

    /**
     * @throws AddressException if the name does not resolve
     */
    static InetAddress resolveHost(String host, IpFamily family)
    {
        InetAddress[] all;
        try {
            all = InetAddress.getAllByName(host);
        } catch (UnknownHostException e) {
            throw new AddressException("Cannot resolve host " + host, e);
        } catch (SecurityException e) {
            throw new AddressException("Not allowed to resolve host " + host, e);
        }
        for (InetAddress a : all) {
            if (family == IpFamily.IPV6 ? a instanceof Inet6Address : a instanceof Inet4Address) {
                return a;
            }
        }
        return all[0];
    }
}
