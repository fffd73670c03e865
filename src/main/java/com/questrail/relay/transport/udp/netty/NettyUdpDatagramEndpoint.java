package com.questrail.relay.transport.udp.netty;

import com.questrail.relay.api.DatagramPeerId;
import com.questrail.relay.config.RelayServerConfig;
import com.questrail.relay.membership.ReadinessSet;
import com.questrail.relay.observability.DeliveryIssueEvent;
import com.questrail.relay.observability.RelayObservabilitySink;
import com.questrail.relay.observability.RelayTransportEvent;
import com.questrail.relay.transport.DatagramEndpoint;
import com.questrail.relay.transport.DatagramEndpointListener;
import com.questrail.relay.transport.RelaySetupException;
import com.questrail.relay.transport.SendOutcome;
import com.questrail.relay.transport.netty.NettyEventMultiplexer;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelOutboundBuffer;
import io.netty.channel.FixedRecvByteBufAllocator;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.channels.ClosedChannelException;
import java.time.Instant;
import java.util.Objects;

/**
 * NettyUdpDatagramEndpoint
 * =============================================================================
 * Netty-backed implementation of the relay {@link DatagramEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>.
 *
 * It MUST NOT:
 * <ul>
 *   <li>Decide membership</li>
 *   <li>Broadcast on its own</li>
 *   <li>Interpret payload bytes</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code ByteBuf}) MUST NOT escape this
 * package.
 *
 * <p>Inbound payloads are copied into {@code byte[]} and emitted to the port
 * listener together with the exact sender address. One datagram is received
 * per wake-up; datagrams larger than the receive buffer are truncated.
 * Zero-length datagrams are delivered as empty payloads.</p>
 *
 * <h2>Readiness</h2>
 * The datagram socket is the only watched socket of this variant. Members are
 * addresses, not sockets, so an applied readiness set changes nothing here.
 *
 * <h2>Send semantics</h2>
 * A datagram the socket could not take stays in Netty's outbound buffer.
 * While anything is pending there, {@link #trySend} reports
 * {@link SendOutcome.Status#WOULD_BLOCK} and drops the payload.
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} binds the UDP socket on the shared loop and begins receiving.
 * - {@link #stop()} closes the channel. The loop itself is owned by the caller.
 */
public final class NettyUdpDatagramEndpoint implements DatagramEndpoint
{
    private final InetSocketAddress bindAddress;
    private final NettyEventMultiplexer multiplexer;
    private final RelayObservabilitySink sink;
    private final Bootstrap bootstrap;

    private volatile DatagramEndpointListener listener;
    private volatile Channel channel;

    public NettyUdpDatagramEndpoint(RelayServerConfig config,
                                    NettyEventMultiplexer multiplexer,
                                    RelayObservabilitySink sink)
    {
        Objects.requireNonNull(config, "config");
        this.bindAddress = config.bindAddress();
        this.multiplexer = Objects.requireNonNull(multiplexer, "multiplexer");
        this.sink = Objects.requireNonNull(sink, "sink");

        this.bootstrap = new Bootstrap();
        bootstrap.group(multiplexer.group())
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, false)
                .option(ChannelOption.RCVBUF_ALLOCATOR,
                        new FixedRecvByteBufAllocator(config.receiveBufferSize()).maxMessagesPerRead(1))
                .handler(new ChannelInitializer<NioDatagramChannel>() {
                    @Override
                    protected void initChannel(NioDatagramChannel ch)
                    {
                        ch.pipeline().addLast(new InboundHandler());
                    }
                });
    }

    @Override
    public void setListener(DatagramEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        if (listener == null) {
            throw new IllegalStateException("DatagramEndpointListener must be set before start()");
        }
        if (multiplexer.inLoop()) {
            throw new IllegalStateException("start() must not be called from the event loop");
        }

        ChannelFuture bind = bootstrap.bind(bindAddress).awaitUninterruptibly();
        if (!bind.isSuccess()) {
            sink.onTransportEvent(new RelayTransportEvent(
                    Instant.now(), RelayTransportEvent.Kind.DOWN, bindAddress, bind.cause()));
            throw new RelaySetupException("Error binding on " + bindAddress, bind.cause());
        }

        channel = bind.channel();
        sink.onTransportEvent(new RelayTransportEvent(
                Instant.now(), RelayTransportEvent.Kind.UP, channel.localAddress(), null));
    }

    @Override
    public void stop()
    {
        Channel ch = channel;
        channel = null;
        if (ch != null) {
            // channelInactive reports the DOWN transition.
            ch.close();
        }
    }

    @Override
    public void applyReadiness(ReadinessSet<DatagramPeerId> readiness)
    {
        Objects.requireNonNull(readiness, "readiness");
    }

    @Override
    public SendOutcome trySend(DatagramPeerId peer, byte[] payload)
    {
        Objects.requireNonNull(peer, "peer");
        Objects.requireNonNull(payload, "payload");

        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            return SendOutcome.failed(new ClosedChannelException());
        }
        ChannelOutboundBuffer outbound = ch.unsafe().outboundBuffer();
        if (outbound != null && outbound.totalPendingWriteBytes() > 0) {
            return SendOutcome.wouldBlock();
        }

        DatagramPacket pkt = new DatagramPacket(Unpooled.wrappedBuffer(payload), peer.toSocketAddress());
        ch.writeAndFlush(pkt).addListener((ChannelFutureListener) future -> {
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
        Channel ch = channel;
        if (ch == null) {
            throw new IllegalStateException("Endpoint is not started");
        }
        return ch.localAddress();
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Receives Netty {@link DatagramPacket}s and forwards raw payload bytes
     * to the port listener.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<DatagramPacket>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
        {
            DatagramEndpointListener l = listener;
            if (l == null) {
                return;
            }

            final DatagramPeerId sender;
            try {
                sender = DatagramPeerId.of(packet.sender());
            } catch (IllegalArgumentException e) {
                l.onReceiveFailed(e);
                return;
            }

            // Copy the payload into a plain byte[] (Netty containment rule).
            byte[] bytes = ByteBufUtil.getBytes(packet.content());
            l.onDatagram(sender, bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            sink.onTransportEvent(new RelayTransportEvent(
                    Instant.now(), RelayTransportEvent.Kind.DOWN, ctx.channel().localAddress(), null));
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            // Receive errors are per datagram; the socket stays open.
            DatagramEndpointListener l = listener;
            if (l != null) {
                l.onReceiveFailed(cause);
            }
        }
    }
}
