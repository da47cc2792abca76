package com.questrail.cot.transport.netty;

import com.questrail.cot.observability.CotObservabilitySink;
import com.questrail.cot.observability.CotTransportEvent;
import com.questrail.cot.transport.ChannelIOException;
import com.questrail.cot.transport.ChannelPair;
import com.questrail.cot.transport.ChannelWriter;
import com.questrail.cot.transport.Destination;
import com.questrail.cot.transport.SocketBindException;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFactory;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramChannel;
import io.netty.channel.socket.DatagramChannelConfig;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.InternetProtocolFamily;
import io.netty.channel.socket.nio.NioChannelOption;
import io.netty.channel.socket.nio.NioDatagramChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.NetworkInterface;
import java.net.StandardProtocolFamily;
import java.net.StandardSocketOptions;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyDatagramChannel
 * =============================================================================
 * UDP channel for unicast, broadcast and multicast destinations.
 *
 * <h2>Variants</h2>
 * <table>
 *   <caption>Socket setup per destination</caption>
 *   <tr><th>Destination</th><th>Local bind</th><th>Options</th><th>Reader</th></tr>
 *   <tr><td>unicast</td><td>wildcard, ephemeral port</td><td></td><td>yes</td></tr>
 *   <tr><td>unicast {@code +wo}</td><td>wildcard, ephemeral port</td><td></td><td>no</td></tr>
 *   <tr><td>{@code +broadcast}</td><td>wildcard, destination port</td>
 *       <td>SO_BROADCAST, SO_REUSEADDR</td><td>yes</td></tr>
 *   <tr><td>{@code +broadcast+wo}</td><td>wildcard, ephemeral port</td>
 *       <td>SO_BROADCAST</td><td>no</td></tr>
 *   <tr><td>multicast group</td><td>wildcard, destination port, group joined on
 *       the local interface</td><td>SO_REUSEADDR, SO_REUSEPORT, IP_MULTICAST_TTL,
 *       IP_MULTICAST_IF</td><td>yes</td></tr>
 *   <tr><td>multicast group {@code +wo}</td><td>wildcard, ephemeral port</td>
 *       <td>SO_REUSEADDR, SO_REUSEPORT, IP_MULTICAST_TTL, IP_MULTICAST_IF</td><td>no</td></tr>
 * </table>
 *
 * <p>A write-only channel has no inbound handler and exposes no reader, so several
 * clients on one host can share a multicast group without competing for its port.</p>
 *
 * <h2>Netty containment rule</h2>
 * Netty types stay inside this package. Datagram payloads are copied to
 * {@code byte[]} on the event loop.
 */
final class NettyDatagramChannel implements ChannelWriter
{
    private static final Logger log = LoggerFactory.getLogger(NettyDatagramChannel.class);

    private static final boolean REUSE_PORT_SUPPORTED = probeReusePort();

    private final Destination destination;
    private final InetSocketAddress remote;
    private final EventLoopGroup group;
    private final Channel channel;
    private final InboundFrames inbound;
    private final CotObservabilitySink sink;
    private final AtomicBoolean closed = new AtomicBoolean();

    private NettyDatagramChannel(Destination destination, InetSocketAddress remote, EventLoopGroup group,
                                 Channel channel, InboundFrames inbound, CotObservabilitySink sink)
    {
        this.destination = destination;
        this.remote = remote;
        this.group = group;
        this.channel = channel;
        this.inbound = inbound;
        this.sink = sink;
    }

    /**
     * Opens the socket variant selected by {@code destination} and {@code remote}.
     *
     * @param localAddress interface address for multicast; the wildcard picks one
     * @param ttl          multicast time-to-live
     * @throws SocketBindException if the socket cannot be bound, configured or
     *                             joined to the group
     */
    static ChannelPair open(Destination destination, InetSocketAddress remote, InetAddress localAddress,
                            int ttl, CotObservabilitySink sink)
    {
        InetAddress target = remote.getAddress();
        boolean ipv6 = target instanceof Inet6Address;
        boolean multicast = target.isMulticastAddress();
        boolean broadcast = destination.isBroadcast();
        boolean writeOnly = destination.isWriteOnly();

        InternetProtocolFamily family = ipv6 ? InternetProtocolFamily.IPv6 : InternetProtocolFamily.IPv4;
        InboundFrames inbound = writeOnly ? null : new InboundFrames(destination.toString());
        EventLoopGroup group = new NioEventLoopGroup(1);

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channelFactory((ChannelFactory<NioDatagramChannel>) () -> new NioDatagramChannel(family))
                .handler(new ChannelInitializer<DatagramChannel>() {
                    @Override
                    protected void initChannel(DatagramChannel ch)
                    {
                        if (inbound != null) {
                            ch.pipeline().addLast("inbound", new InboundHandler(inbound));
                        }
                    }
                });

        NetworkInterface multicastInterface = null;
        if (broadcast) {
            bootstrap.option(ChannelOption.SO_BROADCAST, true);
            bootstrap.option(ChannelOption.SO_REUSEADDR, true);
        }
        if (multicast) {
            multicastInterface = MulticastInterfaces.select(localAddress, target);
            bootstrap.option(ChannelOption.SO_REUSEADDR, true);
            if (REUSE_PORT_SUPPORTED) {
                bootstrap.option(NioChannelOption.of(StandardSocketOptions.SO_REUSEPORT), true);
            }
            bootstrap.option(ChannelOption.IP_MULTICAST_TTL, ttl);
            bootstrap.option(ChannelOption.IP_MULTICAST_IF, multicastInterface);
        }

        InetAddress wildcard = wildcard(ipv6);
        boolean bindDestinationPort = !writeOnly && (broadcast || multicast);
        InetSocketAddress bindAddress = new InetSocketAddress(wildcard, bindDestinationPort ? remote.getPort() : 0);

        ChannelFuture bound = bootstrap.bind(bindAddress).awaitUninterruptibly();
        if (!bound.isSuccess()) {
            group.shutdownGracefully();
            throw new SocketBindException("Cannot bind " + bindAddress + " for " + destination, bound.cause());
        }
        DatagramChannel channel = (DatagramChannel) bound.channel();

        if (multicast && !writeOnly) {
            ChannelFuture joined = channel.joinGroup(remote, multicastInterface).awaitUninterruptibly();
            if (!joined.isSuccess()) {
                channel.close().awaitUninterruptibly();
                group.shutdownGracefully();
                throw new SocketBindException("Cannot join " + target.getHostAddress()
                        + " on " + multicastInterface.getName(), joined.cause());
            }
        }

        String detail = (multicast ? "multicast" : broadcast ? "broadcast" : "unicast")
                + (writeOnly ? " write-only" : "")
                + ", local " + channel.localAddress()
                + (multicastInterface != null ? " via " + multicastInterface.getName() : "");
        sink.onTransportEvent(new CotTransportEvent(Instant.now(), destination.toString(),
                CotTransportEvent.Kind.OPENED, detail));

        NettyDatagramChannel ch = new NettyDatagramChannel(destination, remote, group, channel, inbound, sink);
        return new ChannelPair(destination, inbound, ch, ch::close);
    }

    @Override
    public void write(byte[] bytes)
    {
        if (!channel.isActive()) {
            throw new ChannelIOException("Socket closed: " + destination);
        }
        ChannelFuture f = channel.writeAndFlush(new DatagramPacket(Unpooled.wrappedBuffer(bytes), remote));
        try {
            f.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChannelIOException("Interrupted while sending to " + destination, e);
        }
        if (!f.isSuccess()) {
            throw new ChannelIOException("Send to " + destination + " failed", f.cause());
        }
    }

    InetSocketAddress localAddress()
    {
        return (InetSocketAddress) channel.localAddress();
    }

    DatagramChannelConfig socketConfig()
    {
        return ((DatagramChannel) channel).config();
    }

    void close()
    {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        channel.close().awaitUninterruptibly();
        if (inbound != null) {
            inbound.closed(null);
        }
        group.shutdownGracefully();
        sink.onTransportEvent(new CotTransportEvent(Instant.now(), destination.toString(),
                CotTransportEvent.Kind.CLOSED, ""));
    }

    private static InetAddress wildcard(boolean ipv6)
    {
        return ipv6 ? new InetSocketAddress("::", 0).getAddress() : new InetSocketAddress("0.0.0.0", 0).getAddress();
    }

    private static boolean probeReusePort()
    {
        try (java.nio.channels.DatagramChannel probe = java.nio.channels.DatagramChannel.open(StandardProtocolFamily.INET)) {
            return probe.supportedOptions().contains(StandardSocketOptions.SO_REUSEPORT);
        } catch (IOException | UnsupportedOperationException e) {
            log.debug("SO_REUSEPORT not available: {}", e.toString());
            return false;
        }
    }

    private static final class InboundHandler extends SimpleChannelInboundHandler<DatagramPacket>
    {
        private final InboundFrames inbound;

        InboundHandler(InboundFrames inbound)
        {
            this.inbound = inbound;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
        {
            ByteBuf content = packet.content();
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);
            inbound.offer(bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            inbound.closed(null);
            ctx.fireChannelInactive();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            // ICMP port-unreachable surfaces here on some platforms; UDP keeps going.
            log.debug("Datagram channel {} error: {}", ctx.channel(), cause.toString());
        }
    }
}
