package com.questrail.relay.observability;

import java.time.Instant;

/**
 * Record representing an error in the relay. Errors are per-peer or
 * per-endpoint; none of them stops the loop.
 */
public record RelayErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
