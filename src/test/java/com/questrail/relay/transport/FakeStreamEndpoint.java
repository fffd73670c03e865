package com.questrail.relay.transport;

import com.questrail.relay.api.StreamPeerId;
import com.questrail.relay.membership.ReadinessSet;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * FakeStreamEndpoint
 * -----------------------------------------------------------------------------
 * Test-only {@link StreamEndpoint} implementation.
 *
 * <p>It contains no relay semantics; it records outbound payloads and applied
 * readiness sets, and lets tests inject accepts, reads and closes.</p>
 */
public final class FakeStreamEndpoint implements StreamEndpoint {

    public record Sent(StreamPeerId peer, byte[] payload) {}

    private final FakePeerSender<StreamPeerId> sender = new FakePeerSender<>();
    private final List<ReadinessSet<StreamPeerId>> applied = new ArrayList<>();
    private StreamEndpointListener listener;
    private boolean started;
    private boolean stopped;
    private long nextHandle;

    @Override
    public void setListener(StreamEndpointListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start() {
        started = true;
    }

    @Override
    public void stop() {
        stopped = true;
    }

    @Override
    public void applyReadiness(ReadinessSet<StreamPeerId> readiness) {
        applied.add(Objects.requireNonNull(readiness, "readiness"));
    }

    @Override
    public SendOutcome trySend(StreamPeerId peer, byte[] payload) {
        return sender.trySend(peer, payload);
    }

    @Override
    public SocketAddress localAddress() {
        return new InetSocketAddress("127.0.0.1", 0);
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public StreamPeerId injectAccept() {
        long handle = nextHandle++;
        StreamPeerId peer = new StreamPeerId(handle, new InetSocketAddress("127.0.0.1", 40000 + (int) handle));
        requireListener().onAccepted(peer);
        return peer;
    }

    public void injectAcceptFailure(Throwable cause) {
        requireListener().onAcceptFailed(cause);
    }

    public void injectRead(StreamPeerId peer, byte[] payload) {
        requireListener().onRead(peer, payload);
    }

    public void injectEndOfStream(StreamPeerId peer) {
        requireListener().onEndOfStream(peer);
    }

    public void injectReadFailure(StreamPeerId peer, Throwable cause) {
        requireListener().onReadFailed(peer, cause);
    }

    public FakePeerSender<StreamPeerId> sender() {
        return sender;
    }

    public List<ReadinessSet<StreamPeerId>> appliedReadiness() {
        return Collections.unmodifiableList(applied);
    }

    public ReadinessSet<StreamPeerId> lastReadiness() {
        return applied.get(applied.size() - 1);
    }

    public boolean isStarted() {
        return started;
    }

    public boolean isStopped() {
        return stopped;
    }

    private StreamEndpointListener requireListener() {
        if (listener == null) {
            throw new IllegalStateException("No listener installed");
        }
        return listener;
    }
}
