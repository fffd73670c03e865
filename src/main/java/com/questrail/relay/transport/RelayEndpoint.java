package com.questrail.relay.transport;

import com.questrail.relay.api.PeerId;
import com.questrail.relay.membership.ReadinessSet;

import java.net.SocketAddress;

/**
 * RelayEndpoint
 * -----------------------------------------------------------------------------
 * Transport boundary shared by the stream and datagram variants.
 *
 * <p>Implementations perform transport I/O only. They do not decide who is a
 * member, do not broadcast, and do not interpret payloads. Everything above
 * this port sees only {@link PeerId}s, {@code byte[]} payloads and lifecycle
 * notifications.</p>
 *
 * <p>All listener callbacks and all calls into this endpoint happen on the one
 * event loop thread, except {@link #start()} and {@link #stop()}.</p>
 */
public interface RelayEndpoint<P extends PeerId> extends PeerSender<P>
{
    /**
     * Binds the endpoint and begins watching for readiness.
     *
     * <p>Returns once the socket is bound (and listening, for streams).</p>
     *
     * @throws RelaySetupException if the socket
     *         cannot be created, bound or put into listening state
     */
    void start();

    /**
     * Closes the listening socket and every peer connection. Idempotent.
     */
    void stop();

    /**
     * Applies a freshly derived readiness set: sources for new members start
     * being watched, sources that are no longer members stop being watched.
     */
    void applyReadiness(ReadinessSet<P> readiness);

    /**
     * Locally bound address. Only valid after {@link #start()}.
     */
    SocketAddress localAddress();
}
