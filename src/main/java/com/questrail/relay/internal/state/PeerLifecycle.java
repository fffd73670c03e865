package com.questrail.relay.internal.state;

/**
 * Per-peer lifecycle states.
 *
 * <pre>
 *   UNKNOWN ──admit──► ACTIVE ──evict──► REMOVED
 * </pre>
 *
 * <p>{@code REMOVED} is terminal for that membership entry. No per-peer state
 * survives removal, so a datagram address that sends again after leaving is
 * simply {@code UNKNOWN} once more and starts a fresh entry.</p>
 */
public enum PeerLifecycle
{
    UNKNOWN,
    ACTIVE,
    REMOVED;

    /**
     * Returns {@code true} if a move from this state to {@code next} is legal.
     * Staying in the same state is always legal.
     */
    public boolean canTransitionTo(PeerLifecycle next)
    {
        if (next == this) {
            return true;
        }
        return switch (this) {
            case UNKNOWN -> next == ACTIVE;
            case ACTIVE -> next == REMOVED;
            case REMOVED -> false;
        };
    }
}
