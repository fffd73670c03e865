package com.questrail.relay.internal.state;

import com.questrail.relay.api.DatagramPeerId;
import com.questrail.relay.internal.events.PeerRead;
import com.questrail.relay.internal.events.ReadResult;
import com.questrail.relay.internal.events.ReceiveFailed;
import com.questrail.relay.internal.events.RelayEvent;
import com.questrail.relay.internal.events.TerminationRequested;
import com.questrail.relay.membership.MembershipView;

import java.util.Objects;

/**
 * DatagramLifecyclePolicy
 * -----------------------------------------------------------------------------
 * Membership rules for the connectionless variant.
 *
 * <p>Datagrams carry no connect or disconnect events, so membership is
 * inferred from traffic:</p>
 * <ul>
 *   <li>a non-empty datagram from an unknown address admits that address
 *       <em>before</em> the broadcast, so the sender gets its own message</li>
 *   <li>an empty datagram from a member is the deliberate leave signal: the
 *       address is evicted and nothing is broadcast</li>
 *   <li>an empty datagram from an unknown address is an anomaly and is
 *       ignored</li>
 *   <li>re-inserting a known address is idempotent and silent</li>
 * </ul>
 *
 * <p>Receive failures are reported but never evict anyone: a datagram socket
 * error cannot be attributed to a single sender.</p>
 */
public final class DatagramLifecyclePolicy implements LifecyclePolicy<DatagramPeerId>
{
    @Override
    public Result apply(MembershipView<DatagramPeerId> members, RelayEvent event)
    {
        Objects.requireNonNull(members, "members");
        Objects.requireNonNull(event, "event");

        if (event instanceof PeerRead<?> e && e.peer() instanceof DatagramPeerId peer) {
            return onRead(members, peer, e.result());
        }
        if (event instanceof ReceiveFailed e) {
            return Result.of(RelayIntents.failure("Error receiving message", e.cause()));
        }
        if (event instanceof TerminationRequested) {
            return Result.of(RelayIntents.stop());
        }

        return Result.of(RelayIntents.anomaly("Unexpected event for datagram relay: " + event));
    }

    private Result onRead(MembershipView<DatagramPeerId> members, DatagramPeerId peer, ReadResult result)
    {
        boolean known = members.contains(peer);

        if (result instanceof ReadResult.Failure failure) {
            return Result.of(RelayIntents.failure("Error receiving message from " + peer.describe(), failure.cause()));
        }
        if (result instanceof ReadResult.EndOfStream) {
            return Result.of(RelayIntents.anomaly("End of stream reported for datagram peer " + peer.describe()));
        }

        ReadResult.Data data = (ReadResult.Data) result;

        if (data.isEmpty()) {
            if (!known) {
                return Result.of(RelayIntents.anomaly("Empty datagram from unknown sender " + peer.describe()));
            }
            return Result.of(
                    RelayIntents.evict(peer),
                    new Transition(peer, PeerLifecycle.ACTIVE, PeerLifecycle.REMOVED));
        }

        if (!known) {
            return Result.of(
                    RelayIntents.admit(peer).and(RelayIntents.broadcast(peer, data.payload())),
                    new Transition(peer, PeerLifecycle.UNKNOWN, PeerLifecycle.ACTIVE));
        }
        return Result.of(
                RelayIntents.broadcast(peer, data.payload()),
                new Transition(peer, PeerLifecycle.ACTIVE, PeerLifecycle.ACTIVE));
    }
}
