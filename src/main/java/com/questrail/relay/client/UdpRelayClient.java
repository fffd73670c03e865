package com.questrail.relay.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.util.Arrays;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Datagram client bound to an ephemeral local port. Every datagram received
 * on that port is handed to the callback.
 */
final class UdpRelayClient implements RelayClient
{
    private static final Logger log = LoggerFactory.getLogger(UdpRelayClient.class);

    static final int BUFFER_SIZE = 1024;

    private final DatagramSocket socket;
    private final InetSocketAddress server;
    private final Thread receiver;
    private volatile boolean open = true;

    private UdpRelayClient(DatagramSocket socket, InetSocketAddress server, Consumer<byte[]> onMessage)
    {
        this.socket = socket;
        this.server = server;
        this.receiver = new Thread(() -> receive(onMessage), "relay-client-receiver");
        this.receiver.setDaemon(true);
    }

    static UdpRelayClient bind(InetSocketAddress server, Consumer<byte[]> onMessage) throws IOException
    {
        Objects.requireNonNull(server, "server");
        Objects.requireNonNull(onMessage, "onMessage");
        if (server.isUnresolved()) {
            throw new IOException("Cannot resolve " + server.getHostString());
        }

        UdpRelayClient client = new UdpRelayClient(new DatagramSocket(), server, onMessage);
        client.receiver.start();
        return client;
    }

    /**
     * Sends one datagram. An empty payload is a leave request.
     */
    @Override
    public void send(byte[] payload) throws IOException
    {
        Objects.requireNonNull(payload, "payload");
        socket.send(new DatagramPacket(payload, payload.length, server));
    }

    @Override
    public void leave() throws IOException
    {
        send(new byte[0]);
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
        socket.close();
    }

    private void receive(Consumer<byte[]> onMessage)
    {
        byte[] buffer = new byte[BUFFER_SIZE];
        while (open) {
            DatagramPacket packet = new DatagramPacket(buffer, buffer.length);
            try {
                socket.receive(packet);
            } catch (IOException e) {
                if (open) {
                    log.warn("Error receiving from {}", server, e);
                }
                return;
            }
            onMessage.accept(Arrays.copyOf(packet.getData(), packet.getLength()));
        }
    }
}
