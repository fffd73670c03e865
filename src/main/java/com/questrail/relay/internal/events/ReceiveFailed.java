package com.questrail.relay.internal.events;

import java.time.Instant;
import java.util.Objects;

/**
 * A receive failed before any sender could be attributed (datagram socket
 * errors). Reported, never fatal.
 */
public record ReceiveFailed(Instant timestamp, Throwable cause) implements RelayEvent
{
    public ReceiveFailed {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(cause, "cause");
    }
}
