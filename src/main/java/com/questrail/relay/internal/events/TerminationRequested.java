package com.questrail.relay.internal.events;

import java.time.Instant;
import java.util.Objects;

/**
 * Cancellation request observed inside the event loop.
 *
 * <p>Delivered through the same loop as peer activity, so a termination
 * signal is seen with the same latency as any other readiness event.</p>
 */
public record TerminationRequested(Instant timestamp) implements RelayEvent
{
    public TerminationRequested {
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
