package com.questrail.relay.membership;

import com.questrail.relay.api.PeerId;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * ReadinessSet
 * -----------------------------------------------------------------------------
 * Immutable description of everything the event multiplexer should be
 * watching: the fixed sources of a variant plus every current member.
 *
 * <pre>
 *   stream:   {LISTENER, TERMINATION} ∪ members
 *   datagram: {DATAGRAM_SOCKET, TERMINATION} ∪ members
 * </pre>
 *
 * <p>A readiness set is derived from a specific membership {@link #generation()}.
 * Whenever membership changes a new set must be derived and handed to the
 * endpoint before the loop waits again.</p>
 *
 * @param sources    fixed, non-peer sources
 * @param peers      members in insertion order
 * @param generation membership generation this set was derived from
 */
public record ReadinessSet<P extends PeerId>(Set<Source> sources, List<P> peers, long generation)
{
    /** Non-peer sources that may be watched. */
    public enum Source {
        /** Passive listening socket (stream variant). */
        LISTENER,

        /** Bound datagram socket (datagram variant). */
        DATAGRAM_SOCKET,

        /** Cancellation requests delivered through the loop. */
        TERMINATION
    }

    public ReadinessSet {
        Objects.requireNonNull(sources, "sources");
        Objects.requireNonNull(peers, "peers");
        sources = sources.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(sources));
        peers = List.copyOf(peers);
    }

    /**
     * Derives the readiness set for the current state of {@code members}.
     */
    public static <P extends PeerId> ReadinessSet<P> derive(Set<Source> sources, MembershipSet<P> members)
    {
        Objects.requireNonNull(members, "members");
        return new ReadinessSet<>(sources, members.snapshot(), members.generation());
    }

    public boolean watches(Source source)
    {
        return sources.contains(source);
    }

    public boolean watches(P peer)
    {
        return peers.contains(peer);
    }

    /**
     * Total number of watched sources, peers included.
     */
    public int sourceCount()
    {
        return sources.size() + peers.size();
    }

    /**
     * Returns {@code true} if this set no longer reflects {@code members}.
     */
    public boolean isStale(MembershipSet<P> members)
    {
        return generation != members.generation();
    }
}
