package com.questrail.relay.observability;

import java.net.SocketAddress;
import java.time.Instant;

/**
 * Record representing an endpoint lifecycle change.
 *
 * @param cause may be {@code null} for orderly transitions
 */
public record RelayTransportEvent(
    Instant timestamp,
    Kind kind,
    SocketAddress address,
    Throwable cause
) {
    public enum Kind {
        UP,
        DOWN
    }
}
