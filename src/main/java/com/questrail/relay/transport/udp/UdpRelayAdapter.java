package com.questrail.relay.transport.udp;

import com.questrail.relay.api.DatagramPeerId;
import com.questrail.relay.internal.events.PeerRead;
import com.questrail.relay.internal.events.ReadResult;
import com.questrail.relay.internal.events.ReceiveFailed;
import com.questrail.relay.internal.exec.MessageRouter;
import com.questrail.relay.transport.DatagramEndpoint;
import com.questrail.relay.transport.DatagramEndpointListener;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * UdpRelayAdapter
 * =============================================================================
 * Translates datagram endpoint callbacks into relay events.
 *
 * <pre>
 *   DatagramEndpoint
 *        → UdpRelayAdapter
 *            → PeerRead(sender, Data) / ReceiveFailed
 *                → MessageRouter
 * </pre>
 *
 * <p>Every datagram, empty or not, becomes one {@link PeerRead} carrying its
 * exact sender. Whether an empty datagram is a leave request is the lifecycle
 * policy's decision, not this adapter's.</p>
 */
public final class UdpRelayAdapter implements DatagramEndpointListener {

    private final MessageRouter<DatagramPeerId> router;
    private final DatagramEndpoint endpoint;
    private final Clock clock;

    public UdpRelayAdapter(MessageRouter<DatagramPeerId> router, DatagramEndpoint endpoint) {
        this(router, endpoint, Clock.systemUTC());
    }

    public UdpRelayAdapter(MessageRouter<DatagramPeerId> router, DatagramEndpoint endpoint, Clock clock) {
        this.router = Objects.requireNonNull(router, "router");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.clock = Objects.requireNonNull(clock, "clock");

        this.endpoint.setListener(this);
    }

    public void start() {
        endpoint.start();
    }

    @Override
    public void onDatagram(DatagramPeerId sender, byte[] payload) {
        Objects.requireNonNull(sender, "sender");
        Objects.requireNonNull(payload, "payload");
        router.route(new PeerRead<>(Instant.now(clock), sender, ReadResult.data(payload)));
    }

    @Override
    public void onReceiveFailed(Throwable cause) {
        router.route(new ReceiveFailed(Instant.now(clock), cause));
    }
}
