package com.questrail.relay.internal.events;

import com.questrail.relay.api.PeerId;

import java.time.Instant;
import java.util.Objects;

/**
 * Result of one bounded read attributed to a specific peer.
 *
 * <p>For the stream variant {@code peer} is the connection that became
 * readable; for the datagram variant it is the sender address of the received
 * datagram.</p>
 */
public record PeerRead<P extends PeerId>(Instant timestamp, P peer, ReadResult result) implements RelayEvent
{
    public PeerRead {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(peer, "peer");
        Objects.requireNonNull(result, "result");
    }
}
