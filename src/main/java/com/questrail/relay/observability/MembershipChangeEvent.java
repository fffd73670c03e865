package com.questrail.relay.observability;

import com.questrail.relay.api.PeerId;
import com.questrail.relay.internal.state.PeerLifecycle;

import java.time.Instant;

/**
 * Record representing a peer lifecycle change.
 */
public record MembershipChangeEvent(
    Instant timestamp,
    PeerId peer,
    PeerLifecycle from,
    PeerLifecycle to,
    int memberCount
) {
    public boolean isJoin() {
        return to == PeerLifecycle.ACTIVE;
    }

    public boolean isLeave() {
        return to == PeerLifecycle.REMOVED;
    }
}
