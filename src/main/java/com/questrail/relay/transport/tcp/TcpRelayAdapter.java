package com.questrail.relay.transport.tcp;

import com.questrail.relay.api.StreamPeerId;
import com.questrail.relay.internal.events.AcceptFailed;
import com.questrail.relay.internal.events.ConnectionAccepted;
import com.questrail.relay.internal.events.PeerRead;
import com.questrail.relay.internal.events.ReadResult;
import com.questrail.relay.internal.exec.MessageRouter;
import com.questrail.relay.transport.StreamEndpoint;
import com.questrail.relay.transport.StreamEndpointListener;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * TcpRelayAdapter
 * =============================================================================
 * Translates stream endpoint callbacks into relay events.
 *
 * <h2>Inbound path</h2>
 *
 * <pre>
 *   StreamEndpoint
 *        → TcpRelayAdapter
 *            → RelayEvent (ConnectionAccepted / PeerRead / AcceptFailed)
 *                → MessageRouter
 * </pre>
 *
 * <h2>Outbound path</h2>
 * The router sends through the endpoint directly; this adapter never sends.
 *
 * <p>This class MUST NOT decide membership or interpret payload bytes. Each
 * callback becomes exactly one event, routed immediately, so every stimulus is
 * fully resolved before the next one is processed.</p>
 */
public final class TcpRelayAdapter implements StreamEndpointListener {

    private final MessageRouter<StreamPeerId> router;
    private final StreamEndpoint endpoint;
    private final Clock clock;

    public TcpRelayAdapter(MessageRouter<StreamPeerId> router, StreamEndpoint endpoint) {
        this(router, endpoint, Clock.systemUTC());
    }

    public TcpRelayAdapter(MessageRouter<StreamPeerId> router, StreamEndpoint endpoint, Clock clock) {
        this.router = Objects.requireNonNull(router, "router");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.clock = Objects.requireNonNull(clock, "clock");

        this.endpoint.setListener(this);
    }

    public void start() {
        endpoint.start();
    }

    // -------------------------------------------------------------------------
    // StreamEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public void onAccepted(StreamPeerId peer) {
        router.route(new ConnectionAccepted(now(), peer));
    }

    @Override
    public void onAcceptFailed(Throwable cause) {
        router.route(new AcceptFailed(now(), cause));
    }

    @Override
    public void onRead(StreamPeerId peer, byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        router.route(new PeerRead<>(now(), peer, ReadResult.data(payload)));
    }

    @Override
    public void onEndOfStream(StreamPeerId peer) {
        router.route(new PeerRead<>(now(), peer, ReadResult.endOfStream()));
    }

    @Override
    public void onReadFailed(StreamPeerId peer, Throwable cause) {
        router.route(new PeerRead<>(now(), peer, ReadResult.failure(cause)));
    }

    private Instant now() {
        return Instant.now(clock);
    }
}
