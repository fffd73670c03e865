package com.questrail.relay.observability;

import com.questrail.relay.api.PeerId;
import com.questrail.relay.transport.SendOutcome;

import java.time.Instant;

/**
 * Record representing a delivery that was dropped or failed for one peer.
 */
public record DeliveryIssueEvent(
    Instant timestamp,
    PeerId peer,
    SendOutcome outcome
) {
}
