package com.questrail.relay.client;

import com.questrail.relay.api.RelayTransport;
import com.questrail.relay.config.RelayServerConfig;
import com.questrail.relay.runtime.RelayServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RelayClientTest {

    private RelayServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.close();
        }
    }

    private InetSocketAddress startServer(RelayTransport transport) {
        server = RelayServer.builder()
            .withConfig(RelayServerConfig.builder()
                .withTransport(transport)
                .withBindAddress(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0))
                .build())
            .build();
        server.start();
        return (InetSocketAddress) server.localAddress();
    }

    private void awaitMemberCount(int expected) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (server.members().size() != expected) {
            assertTrue(System.nanoTime() < deadline, "member count never reached " + expected);
            Thread.sleep(10);
        }
    }

    @Test
    void tcpClientReceivesItsOwnBroadcast() throws Exception {
        InetSocketAddress address = startServer(RelayTransport.TCP);
        BlockingQueue<byte[]> received = new LinkedBlockingQueue<>();

        try (RelayClient client = RelayClient.open(RelayTransport.TCP, address, received::add)) {
            awaitMemberCount(1);
            client.send("hello\n".getBytes(StandardCharsets.US_ASCII));

            byte[] echoed = received.poll(5, TimeUnit.SECONDS);
            assertNotNull(echoed);
            assertEquals("hello\n", new String(echoed, StandardCharsets.US_ASCII));

            client.leave();
            assertFalse(client.isOpen());
        }
        awaitMemberCount(0);
    }

    @Test
    void tcpClientNoticesWhenTheRelayGoesAway() throws Exception {
        InetSocketAddress address = startServer(RelayTransport.TCP);

        try (RelayClient client = RelayClient.open(RelayTransport.TCP, address, bytes -> {})) {
            awaitMemberCount(1);
            server.close();

            long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
            while (client.isOpen()) {
                assertTrue(System.nanoTime() < deadline, "client never saw the connection close");
                Thread.sleep(10);
            }
            assertThrows(IOException.class, () -> client.send("late\n".getBytes(StandardCharsets.US_ASCII)));
        }
    }

    @Test
    void tcpConnectFailureIsAnIOException() throws Exception {
        int freePort;
        try (ServerSocket reserved = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            freePort = reserved.getLocalPort();
        }
        InetSocketAddress nobody = new InetSocketAddress(InetAddress.getLoopbackAddress(), freePort);

        assertThrows(IOException.class, () -> RelayClient.open(RelayTransport.TCP, nobody, bytes -> {}));
    }

    @Test
    void tcpClientRejectsEmptyPayloads() throws Exception {
        InetSocketAddress address = startServer(RelayTransport.TCP);

        try (RelayClient client = RelayClient.open(RelayTransport.TCP, address, bytes -> {})) {
            assertThrows(IllegalArgumentException.class, () -> client.send(new byte[0]));
        }
    }

    @Test
    void udpClientJoinsAndLeaves() throws Exception {
        InetSocketAddress address = startServer(RelayTransport.UDP);
        BlockingQueue<byte[]> received = new LinkedBlockingQueue<>();

        try (RelayClient client = RelayClient.open(RelayTransport.UDP,
                new InetSocketAddress(InetAddress.getLoopbackAddress(), address.getPort()), received::add)) {
            client.send("ping\n".getBytes(StandardCharsets.US_ASCII));

            byte[] echoed = received.poll(5, TimeUnit.SECONDS);
            assertNotNull(echoed);
            assertEquals("ping\n", new String(echoed, StandardCharsets.US_ASCII));
            assertEquals(1, server.members().size());

            client.leave();
            awaitMemberCount(0);
        }
    }

    @Test
    void interactiveSessionEndsOnEmptyLine() throws Exception {
        InetSocketAddress address = startServer(RelayTransport.UDP);
        ByteArrayInputStream stdin = new ByteArrayInputStream("one\n\nignored\n".getBytes(StandardCharsets.UTF_8));
        ByteArrayOutputStream stdout = new ByteArrayOutputStream();

        int status = RelayClientMain.run(stdin, new PrintStream(stdout, true, StandardCharsets.UTF_8),
            "--udp", InetAddress.getLoopbackAddress().getHostAddress(), Integer.toString(address.getPort()));

        assertEquals(RelayClientMain.EXIT_OK, status);
        awaitMemberCount(0);
    }

    @Test
    void clientOptionsParsing() {
        RelayClientMain.Options options = RelayClientMain.Options.parse("--udp", "localhost", "5000");

        assertEquals(RelayTransport.UDP, options.transport());
        assertEquals(5000, options.server().getPort());
        assertEquals(RelayTransport.TCP, RelayClientMain.Options.parse("localhost", "5000").transport());
        assertThrows(IllegalArgumentException.class, () -> RelayClientMain.Options.parse("localhost"));
        assertThrows(IllegalArgumentException.class, () -> RelayClientMain.Options.parse("--x", "h", "1"));
    }
}
