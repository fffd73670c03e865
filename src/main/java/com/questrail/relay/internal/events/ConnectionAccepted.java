package com.questrail.relay.internal.events;

import com.questrail.relay.api.StreamPeerId;

import java.time.Instant;
import java.util.Objects;

/**
 * The stream listener accepted a new connection.
 */
public record ConnectionAccepted(Instant timestamp, StreamPeerId peer) implements RelayEvent
{
    public ConnectionAccepted {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(peer, "peer");
    }
}
