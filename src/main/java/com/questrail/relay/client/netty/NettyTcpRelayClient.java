package com.questrail.relay.client.netty;

import com.questrail.relay.client.RelayClient;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.FixedRecvByteBufAllocator;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.channels.ClosedChannelException;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Stream client on a private one-thread Netty loop. Each bounded read of the
 * connection is handed to the callback as one payload, on the loop thread.
 *
 * <p>{@link #send(byte[])} waits for the write to complete and must not be
 * called from the callback.</p>
 */
public final class NettyTcpRelayClient implements RelayClient
{
    private static final Logger log = LoggerFactory.getLogger(NettyTcpRelayClient.class);

    static final int BUFFER_SIZE = 1024;

    private final EventLoopGroup group;
    private final Channel channel;
    private volatile boolean open = true;

    private NettyTcpRelayClient(EventLoopGroup group, Channel channel)
    {
        this.group = group;
        this.channel = channel;
    }

    public static NettyTcpRelayClient connect(InetSocketAddress server, Consumer<byte[]> onMessage) throws IOException
    {
        Objects.requireNonNull(server, "server");
        Objects.requireNonNull(onMessage, "onMessage");

        EventLoopGroup group = new NioEventLoopGroup(1, new DefaultThreadFactory("relay-client"));
        InboundHandler handler = new InboundHandler(onMessage);

        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(BUFFER_SIZE))
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ch.pipeline().addLast(handler);
                    }
                });

        ChannelFuture connect = bootstrap.connect(server).awaitUninterruptibly();
        if (!connect.isSuccess()) {
            group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
            Throwable cause = connect.cause();
            if (cause instanceof IOException io) {
                throw io;
            }
            throw new IOException("Cannot connect to " + server, cause);
        }

        NettyTcpRelayClient client = new NettyTcpRelayClient(group, connect.channel());
        handler.client = client;
        if (!connect.channel().isActive()) {
            client.open = false;
        }
        log.info("Connected to {}", server);
        return client;
    }

    /**
     * @throws IllegalArgumentException for an empty payload; a stream has no
     *                                  way to carry one
     */
    @Override
    public void send(byte[] payload) throws IOException
    {
        Objects.requireNonNull(payload, "payload");
        if (payload.length == 0) {
            throw new IllegalArgumentException("Stream payloads must not be empty");
        }
        if (!open) {
            throw new ClosedChannelException();
        }

        ChannelFuture write = channel.writeAndFlush(Unpooled.wrappedBuffer(payload)).awaitUninterruptibly();
        if (!write.isSuccess()) {
            Throwable cause = write.cause();
            if (cause instanceof IOException io) {
                throw io;
            }
            throw new IOException("Error sending to " + channel.remoteAddress(), cause);
        }
    }

    @Override
    public void leave()
    {
        close();
    }

    @Override
    public boolean isOpen()
    {
        return open;
    }

    @Override
    public void close()
    {
        open = false;
        channel.close();
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
    }

    private static final class InboundHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        private final Consumer<byte[]> onMessage;
        private volatile NettyTcpRelayClient client;

        InboundHandler(Consumer<byte[]> onMessage)
        {
            this.onMessage = onMessage;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg)
        {
            if (msg.isReadable()) {
                onMessage.accept(ByteBufUtil.getBytes(msg));
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            NettyTcpRelayClient c = client;
            if (c != null && c.open) {
                c.open = false;
                log.info("Server closed connection");
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            NettyTcpRelayClient c = client;
            if (c != null && c.open) {
                log.warn("Error receiving from server", cause);
            }
            ctx.close();
        }
    }
}
