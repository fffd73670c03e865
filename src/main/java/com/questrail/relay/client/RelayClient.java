package com.questrail.relay.client;

import com.questrail.relay.api.RelayTransport;
import com.questrail.relay.client.netty.NettyTcpRelayClient;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * RelayClient
 * -----------------------------------------------------------------------------
 * Minimal peer of a relay server: sends payloads and hands every payload the
 * relay delivers to a callback.
 *
 * <p>Received payloads are delivered on a dedicated receiver thread, one
 * callback per read. {@link #leave()} ends membership the way the transport
 * expects it: the stream client closes its connection, the datagram client
 * sends an empty datagram.</p>
 */
public interface RelayClient extends AutoCloseable
{
    /**
     * Connects (TCP) or binds an ephemeral socket (UDP) and starts receiving.
     */
    static RelayClient open(RelayTransport transport,
                            InetSocketAddress server,
                            Consumer<byte[]> onMessage) throws IOException
    {
        Objects.requireNonNull(transport, "transport");
        return switch (transport) {
            case TCP -> NettyTcpRelayClient.connect(server, onMessage);
            case UDP -> UdpRelayClient.bind(server, onMessage);
        };
    }

    void send(byte[] payload) throws IOException;

    void leave() throws IOException;

    /**
     * {@code false} once the relay closed the connection or the client was
     * closed.
     */
    boolean isOpen();

    @Override
    void close();
}
