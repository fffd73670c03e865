package com.questrail.relay.observability;

import java.time.Instant;

/**
 * Record representing a protocol anomaly that was logged and ignored.
 */
public record RelayAnomalyEvent(
    Instant timestamp,
    String message
) {
}
