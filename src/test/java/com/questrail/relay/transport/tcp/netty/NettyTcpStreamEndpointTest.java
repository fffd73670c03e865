package com.questrail.relay.transport.tcp.netty;

import com.questrail.relay.api.StreamPeerId;
import com.questrail.relay.config.RelayServerConfig;
import com.questrail.relay.membership.ReadinessSet;
import com.questrail.relay.observability.RecordingObservabilitySink;
import com.questrail.relay.transport.SendOutcome;
import com.questrail.relay.transport.StreamEndpointListener;
import com.questrail.relay.transport.netty.NettyEventMultiplexer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the Netty stream endpoint directly, without a router, on a loopback
 * port.
 */
class NettyTcpStreamEndpointTest {

    private static final int TIMEOUT_MS = 5000;

    private NettyEventMultiplexer multiplexer;
    private NettyTcpStreamEndpoint endpoint;
    private RecordingListener listener;
    private InetSocketAddress address;

    @BeforeEach
    void setUp() {
        RelayServerConfig config = RelayServerConfig.builder()
            .withBindAddress(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0))
            .build();
        multiplexer = new NettyEventMultiplexer("endpoint-test");
        endpoint = new NettyTcpStreamEndpoint(config, multiplexer, new RecordingObservabilitySink());
        listener = new RecordingListener();
        endpoint.setListener(listener);
        endpoint.start();
        address = (InetSocketAddress) endpoint.localAddress();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        endpoint.stop();
        multiplexer.shutdown();
        assertTrue(multiplexer.awaitTermination(Duration.ofSeconds(5)));
    }

    @Test
    void dropsPayloadsOnceAConnectionHasUnwrittenBytes() throws Exception {
        byte[] chunk = new byte[1000];

        try (Socket slow = new Socket()) {
            slow.setReceiveBufferSize(1024);
            slow.connect(address, TIMEOUT_MS);
            await(() -> listener.accepted.size() == 1);
            StreamPeerId peer = listener.accepted.get(0);

            int sent = 0;
            SendOutcome outcome = SendOutcome.sent();
            while (outcome.isSent()) {
                assertTrue(sent < 100_000, "kernel buffers never filled");
                outcome = multiplexer.call(() -> endpoint.trySend(peer, chunk));
                sent++;
            }

            assertEquals(SendOutcome.Status.WOULD_BLOCK, outcome.status());
            assertAtMostOnePayloadPending(peer, chunk.length);

            for (int i = 0; i < 50; i++) {
                SendOutcome next = multiplexer.call(() -> endpoint.trySend(peer, chunk));
                assertNotEquals(SendOutcome.Status.FAILED, next.status());
                assertAtMostOnePayloadPending(peer, chunk.length);
            }
        }
    }

    private void assertAtMostOnePayloadPending(StreamPeerId peer, int payloadLength) {
        long pending = multiplexer.call(() -> endpoint.pendingWriteBytes(peer));
        assertTrue(pending <= payloadLength,
            "at most one payload may wait in user space, found " + pending + " bytes");
    }

    @Test
    void acceptsAtMostOneConnectionPerWakeUp() throws Exception {
        listener.markIterations = true;
        CountDownLatch release = pauseLoop();

        List<Socket> clients = new ArrayList<>();
        try {
            for (int i = 0; i < 4; i++) {
                Socket client = new Socket();
                client.connect(address, TIMEOUT_MS);
                clients.add(client);
            }
            release.countDown();

            await(() -> listener.accepted.size() == 4);
            await(() -> listener.events.size() == 8);
            assertEquals(List.of("accept", "|", "accept", "|", "accept", "|", "accept", "|"), listener.events);
        } finally {
            release.countDown();
            for (Socket client : clients) {
                client.close();
            }
        }
    }

    @Test
    void acceptIsDispatchedBeforeAReadOfTheSameWakeUp() throws Exception {
        listener.enableReads = true;

        try (Socket member = new Socket(); Socket newcomer = new Socket()) {
            member.connect(address, TIMEOUT_MS);
            await(() -> listener.accepted.size() == 1);

            CountDownLatch release = pauseLoop();
            try {
                member.getOutputStream().write("hi".getBytes(StandardCharsets.US_ASCII));
                newcomer.connect(address, TIMEOUT_MS);
                Thread.sleep(100);
            } finally {
                release.countDown();
            }

            await(() -> listener.events.size() == 3);
            assertEquals(List.of("accept", "accept", "read:hi"), listener.events);
        }
    }

    @Test
    void closedConnectionStaysMappedUntilItsEndOfStreamIsDispatched() throws Exception {
        listener.enableReads = true;
        try (Socket client = new Socket()) {
            client.connect(address, TIMEOUT_MS);
            await(() -> listener.accepted.size() == 1);
        }
        await(() -> listener.events.contains("eof"));

        StreamPeerId peer = listener.accepted.get(0);
        SendOutcome afterEviction = multiplexer.call(() -> endpoint.trySend(peer, new byte[] {1}));
        assertEquals(SendOutcome.Status.FAILED, afterEviction.status());
        assertEquals(List.of("inactive-while-mapped:WOULD_BLOCK"), listener.sendsOnEndOfStream);
    }

    private CountDownLatch pauseLoop() throws InterruptedException {
        CountDownLatch paused = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        multiplexer.execute(() -> {
            paused.countDown();
            try {
                release.await(TIMEOUT_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        assertTrue(paused.await(TIMEOUT_MS, TimeUnit.MILLISECONDS));
        return release;
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(TIMEOUT_MS);
        while (!condition.getAsBoolean()) {
            assertTrue(System.nanoTime() < deadline, "condition not reached");
            Thread.sleep(5);
        }
    }

    /**
     * Records endpoint callbacks in loop order. Runs on the loop thread.
     */
    private final class RecordingListener implements StreamEndpointListener {
        final List<StreamPeerId> accepted = new CopyOnWriteArrayList<>();
        final List<String> events = new CopyOnWriteArrayList<>();
        final List<String> sendsOnEndOfStream = new CopyOnWriteArrayList<>();
        volatile boolean markIterations;
        volatile boolean enableReads;
        private boolean markerPending;

        @Override
        public void onAccepted(StreamPeerId peer) {
            accepted.add(peer);
            events.add("accept");
            if (enableReads) {
                endpoint.applyReadiness(new ReadinessSet<>(
                    EnumSet.of(ReadinessSet.Source.LISTENER), accepted, accepted.size()));
            }
            if (markIterations && !markerPending) {
                markerPending = true;
                multiplexer.executeAfterIo(() -> {
                    markerPending = false;
                    events.add("|");
                });
            }
        }

        @Override
        public void onAcceptFailed(Throwable cause) {
            events.add("accept-failed");
        }

        @Override
        public void onRead(StreamPeerId peer, byte[] payload) {
            events.add("read:" + new String(payload, StandardCharsets.US_ASCII));
        }

        @Override
        public void onEndOfStream(StreamPeerId peer) {
            sendsOnEndOfStream.add("inactive-while-mapped:"
                + endpoint.trySend(peer, new byte[] {1}).status());
            events.add("eof");
        }

        @Override
        public void onReadFailed(StreamPeerId peer, Throwable cause) {
            events.add("read-failed");
        }
    }
}
