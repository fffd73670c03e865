package com.questrail.relay.internal.events;

import java.time.Instant;
import java.util.Objects;

/**
 * The stream listener failed to accept a pending connection. Never fatal.
 */
public record AcceptFailed(Instant timestamp, Throwable cause) implements RelayEvent
{
    public AcceptFailed {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(cause, "cause");
    }
}
