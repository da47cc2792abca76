package com.questrail.cot.transport.netty;

import com.questrail.cot.observability.CotObservabilitySink;
import com.questrail.cot.observability.CotTransportEvent;
import com.questrail.cot.transport.AddressException;
import com.questrail.cot.transport.ChannelIOException;
import com.questrail.cot.transport.ChannelPair;
import com.questrail.cot.transport.ChannelWriter;
import com.questrail.cot.transport.Destination;
import com.questrail.cot.transport.TlsUpgradable;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.ssl.SslHandler;
import io.netty.util.concurrent.Future;

import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyStreamChannel
 * =============================================================================
 * A connected TCP stream, optionally upgraded to TLS.
 *
 * <h2>Netty containment rule</h2>
 * Netty types stay inside this package. Inbound {@link ByteBuf}s are copied into
 * {@code byte[]} on the event loop and handed to the reader through
 * {@link InboundFrames}; outbound arrays are wrapped without copying.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #connect} blocks until the connection is up or has failed.</li>
 *   <li>{@link #startTls} inserts an {@link SslHandler} in front of the pipeline and
 *       waits for the handshake.</li>
 *   <li>Closing the returned {@link ChannelPair} closes the socket and shuts down the
 *       dedicated event loop.</li>
 * </ul>
 */
final class NettyStreamChannel implements TlsUpgradable, ChannelWriter
{
    private final Destination destination;
    private final EventLoopGroup group;
    private final Channel channel;
    private final InboundFrames inbound;
    private final CotObservabilitySink sink;
    private final AtomicBoolean closed = new AtomicBoolean();

    private NettyStreamChannel(Destination destination, EventLoopGroup group, Channel channel,
                               InboundFrames inbound, CotObservabilitySink sink)
    {
        this.destination = destination;
        this.group = group;
        this.channel = channel;
        this.inbound = inbound;
        this.sink = sink;
    }

    /**
     * @throws AddressException if the connection is refused, times out or the route
     *                          is unreachable
     */
    static NettyStreamChannel connect(Destination destination, InetSocketAddress remote,
                                      Duration connectTimeout, CotObservabilitySink sink)
    {
        Objects.requireNonNull(remote, "remote");
        InboundFrames inbound = new InboundFrames(destination.toString());
        EventLoopGroup group = new NioEventLoopGroup(1);

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, connectTimeout.toMillis()))
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ch.pipeline().addLast("inbound", new InboundHandler(inbound));
                    }
                });

        ChannelFuture f = bootstrap.connect(remote).awaitUninterruptibly();
        if (!f.isSuccess()) {
            group.shutdownGracefully();
            throw new AddressException("Cannot connect to " + destination + " (" + remote + ")", f.cause());
        }

        Channel channel = f.channel();
        sink.onTransportEvent(new CotTransportEvent(Instant.now(), destination.toString(),
                CotTransportEvent.Kind.OPENED, "local " + channel.localAddress()));
        return new NettyStreamChannel(destination, group, channel, inbound, sink);
    }

    ChannelPair toChannelPair() {
        return new ChannelPair(destination, inbound, this, this::close);
    }

    @Override
    public InetSocketAddress remoteAddress() {
        return (InetSocketAddress) channel.remoteAddress();
    }

    @Override
    public ChannelPair startTls(SSLEngine engine, Duration timeout) throws SSLException
    {
        SslHandler ssl = new SslHandler(engine);
        ssl.setHandshakeTimeoutMillis(timeout.toMillis());
        channel.pipeline().addFirst("ssl", ssl);

        Future<Channel> handshake = ssl.handshakeFuture();
        boolean done = handshake.awaitUninterruptibly(timeout.toMillis() + 1000);
        if (!done || !handshake.isSuccess()) {
            close();
            Throwable cause = done ? handshake.cause() : null;
            if (cause instanceof SSLException) {
                throw (SSLException) cause;
            }
            throw new SSLException("TLS handshake with " + destination + " did not complete", cause);
        }

        sink.onTransportEvent(new CotTransportEvent(Instant.now(), destination.toString(),
                CotTransportEvent.Kind.TLS_ESTABLISHED,
                engine.getSession().getProtocol() + " " + engine.getSession().getCipherSuite()));
        return toChannelPair();
    }

    @Override
    public void write(byte[] bytes)
    {
        if (!channel.isActive()) {
            throw new ChannelIOException("Connection closed: " + destination);
        }
        ChannelFuture f = channel.writeAndFlush(Unpooled.wrappedBuffer(bytes));
        try {
            f.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChannelIOException("Interrupted while writing to " + destination, e);
        }
        if (!f.isSuccess()) {
            throw new ChannelIOException("Write to " + destination + " failed", f.cause());
        }
    }

    @Override
    public void close()
    {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        channel.close().awaitUninterruptibly();
        inbound.closed(null);
        group.shutdownGracefully();
        sink.onTransportEvent(new CotTransportEvent(Instant.now(), destination.toString(),
                CotTransportEvent.Kind.CLOSED, ""));
    }

    /**
     * Copies each inbound buffer into a {@code byte[]} (Netty containment rule).
     */
    private static final class InboundHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        private final InboundFrames inbound;

        InboundHandler(InboundFrames inbound)
        {
            this.inbound = inbound;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf content)
        {
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
            inbound.closed(cause);
            ctx.close();
        }
    }
}
