package com.questrail.relay.transport.tcp.netty;

import com.questrail.relay.api.StreamPeerId;
import com.questrail.relay.config.RelayServerConfig;
import com.questrail.relay.membership.ReadinessSet;
import com.questrail.relay.observability.DeliveryIssueEvent;
import com.questrail.relay.observability.RelayObservabilitySink;
import com.questrail.relay.observability.RelayTransportEvent;
import com.questrail.relay.transport.RelaySetupException;
import com.questrail.relay.transport.SendOutcome;
import com.questrail.relay.transport.StreamEndpoint;
import com.questrail.relay.transport.StreamEndpointListener;
import com.questrail.relay.transport.netty.NettyEventMultiplexer;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelOutboundBuffer;
import io.netty.channel.FixedRecvByteBufAllocator;
import io.netty.channel.ServerChannelRecvByteBufAllocator;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.channels.ClosedChannelException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * NettyTcpStreamEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link StreamEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It owns the
 * listening socket and the accepted connections, and translates Netty
 * callbacks into {@link StreamEndpointListener} calls. It does not decide
 * membership and does not broadcast.
 *
 * <h2>Readiness semantics</h2>
 * <ul>
 *   <li>The listening channel and every accepted channel are registered with
 *       the one loop of the shared {@link NettyEventMultiplexer}.</li>
 *   <li>The listener accepts at most one pending connection per wake-up
 *       (a server allocator with {@code maxMessagesPerRead = 1}); further
 *       pending connections are picked up by the next level-triggered
 *       wake-up.</li>
 *   <li>Accepted channels start with auto-read off. A channel is read only
 *       once it appears in an applied {@link ReadinessSet}; a channel that
 *       drops out of the readiness set is closed.</li>
 *   <li>Each ready channel gets one bounded read per wake-up
 *       ({@link FixedRecvByteBufAllocator} of the configured size).</li>
 *   <li>Accept notifications are delivered immediately, read results after
 *       the I/O of the current iteration, so accepts precede reads within one
 *       wake-up.</li>
 * </ul>
 *
 * <h2>Send semantics</h2>
 * {@link #trySend} never blocks and never queues behind a full socket. A
 * channel that still holds unwritten bytes in its outbound buffer reports
 * {@link SendOutcome.Status#WOULD_BLOCK} and the payload is dropped for that
 * channel, so at most the one payload the kernel did not take is pending per
 * connection. A connection that is closing but not yet evicted also reports
 * WOULD_BLOCK. Write failures that surface after the payload was handed to
 * Netty are reported to the observability sink.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code ByteBuf}) MUST NOT escape this
 * package. Inbound payloads are copied into {@code byte[]}.
 */
public final class NettyTcpStreamEndpoint implements StreamEndpoint
{
    private final InetSocketAddress bindAddress;
    private final NettyEventMultiplexer multiplexer;
    private final RelayObservabilitySink sink;
    private final ServerBootstrap bootstrap;

    // Loop-confined.
    private final Map<StreamPeerId, Channel> connections = new HashMap<>();
    private long nextHandle;

    private volatile StreamEndpointListener listener;
    private volatile Channel serverChannel;

    public NettyTcpStreamEndpoint(RelayServerConfig config,
                                  NettyEventMultiplexer multiplexer,
                                  RelayObservabilitySink sink)
    {
        Objects.requireNonNull(config, "config");
        this.bindAddress = config.bindAddress();
        this.multiplexer = Objects.requireNonNull(multiplexer, "multiplexer");
        this.sink = Objects.requireNonNull(sink, "sink");

        this.bootstrap = new ServerBootstrap();
        bootstrap.group(multiplexer.group())
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, config.backlog())
                .option(ChannelOption.RCVBUF_ALLOCATOR, new ServerChannelRecvByteBufAllocator().maxMessagesPerRead(1))
                .handler(new ListenerHandler())
                .childOption(ChannelOption.AUTO_READ, false)
                .childOption(ChannelOption.RCVBUF_ALLOCATOR,
                        new FixedRecvByteBufAllocator(config.receiveBufferSize()).maxMessagesPerRead(1))
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ch.pipeline().addLast(new PeerHandler());
                    }
                });
    }

    @Override
    public void setListener(StreamEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        requireListener();
        if (multiplexer.inLoop()) {
            throw new IllegalStateException("start() must not be called from the event loop");
        }

        ChannelFuture bind = bootstrap.bind(bindAddress).awaitUninterruptibly();
        if (!bind.isSuccess()) {
            sink.onTransportEvent(new RelayTransportEvent(
                    Instant.now(), RelayTransportEvent.Kind.DOWN, bindAddress, bind.cause()));
            throw new RelaySetupException("Error binding/listening on " + bindAddress, bind.cause());
        }

        serverChannel = bind.channel();
        sink.onTransportEvent(new RelayTransportEvent(
                Instant.now(), RelayTransportEvent.Kind.UP, serverChannel.localAddress(), null));
    }

    @Override
    public void stop()
    {
        if (!multiplexer.inLoop()) {
            multiplexer.execute(this::stop);
            return;
        }

        Channel server = serverChannel;
        serverChannel = null;
        if (server != null) {
            server.close();
        }

        List<Channel> open = new ArrayList<>(connections.values());
        for (Channel ch : open) {
            ch.close();
        }

        if (server != null) {
            sink.onTransportEvent(new RelayTransportEvent(
                    Instant.now(), RelayTransportEvent.Kind.DOWN, server.localAddress(), null));
        }
    }

    @Override
    public void applyReadiness(ReadinessSet<StreamPeerId> readiness)
    {
        Objects.requireNonNull(readiness, "readiness");

        for (Map.Entry<StreamPeerId, Channel> entry : new ArrayList<>(connections.entrySet())) {
            Channel ch = entry.getValue();
            if (readiness.watches(entry.getKey())) {
                if (!ch.config().isAutoRead()) {
                    ch.config().setAutoRead(true);
                }
            } else {
                ch.close();
            }
        }
    }

    @Override
    public SendOutcome trySend(StreamPeerId peer, byte[] payload)
    {
        Objects.requireNonNull(peer, "peer");
        Objects.requireNonNull(payload, "payload");

        Channel ch = connections.get(peer);
        if (ch == null) {
            return SendOutcome.failed(new ClosedChannelException());
        }
        // An inactive channel is already on its way out; its end of stream
        // is routed after this iteration.
        if (!ch.isActive() || pendingWriteBytes(ch) > 0) {
            return SendOutcome.wouldBlock();
        }

        ch.writeAndFlush(Unpooled.wrappedBuffer(payload)).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                sink.onDeliveryIssue(new DeliveryIssueEvent(
                        Instant.now(), peer, SendOutcome.failed(future.cause())));
            }
        });
        return SendOutcome.sent();
    }

    @Override
    public SocketAddress localAddress()
    {
        Channel server = serverChannel;
        if (server == null) {
            throw new IllegalStateException("Endpoint is not started");
        }
        return server.localAddress();
    }

    /**
     * Bytes handed to Netty for {@code peer} that the kernel has not taken
     * yet. Must be called on the loop.
     */
    long pendingWriteBytes(StreamPeerId peer)
    {
        Channel ch = connections.get(peer);
        return ch == null ? 0 : pendingWriteBytes(ch);
    }

    private static long pendingWriteBytes(Channel ch)
    {
        ChannelOutboundBuffer outbound = ch.unsafe().outboundBuffer();
        return outbound == null ? 0 : outbound.totalPendingWriteBytes();
    }

    private void requireListener()
    {
        if (listener == null) {
            throw new IllegalStateException("StreamEndpointListener must be set before start()");
        }
    }

    /**
     * ListenerHandler
     * -------------------------------------------------------------------------
     * Sits on the listening channel. Accept errors surface here; they are
     * reported and the listener keeps accepting.
     */
    private final class ListenerHandler extends ChannelInboundHandlerAdapter
    {
        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            StreamEndpointListener l = listener;
            if (l != null) {
                l.onAcceptFailed(cause);
            }
        }
    }

    /**
     * PeerHandler
     * -------------------------------------------------------------------------
     * One instance per accepted connection. Copies each bounded read into a
     * {@code byte[]} and forwards it to the port listener.
     */
    private final class PeerHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        private StreamPeerId peer;

        @Override
        public void channelActive(ChannelHandlerContext ctx)
        {
            Channel ch = ctx.channel();
            peer = new StreamPeerId(nextHandle++, ch.remoteAddress());
            connections.put(peer, ch);

            StreamEndpointListener l = listener;
            if (l != null) {
                l.onAccepted(peer);
            }
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg)
        {
            StreamEndpointListener l = listener;
            if (l == null || peer == null) {
                return;
            }

            if (!msg.isReadable()) {
                return;
            }
            byte[] bytes = ByteBufUtil.getBytes(msg);
            StreamPeerId from = peer;
            multiplexer.executeAfterIo(() -> l.onRead(from, bytes));
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            if (peer == null) {
                return;
            }

            // The connection stays mapped until its end of stream is routed,
            // so a broadcast earlier in this iteration sees it as closing.
            StreamPeerId from = peer;
            multiplexer.executeAfterIo(() -> {
                StreamEndpointListener l = listener;
                if (l != null) {
                    l.onEndOfStream(from);
                }
                connections.remove(from);
            });
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            StreamEndpointListener l = listener;
            if (l != null && peer != null) {
                StreamPeerId from = peer;
                multiplexer.executeAfterIo(() -> l.onReadFailed(from, cause));
            }
            ctx.close();
        }
    }
}
