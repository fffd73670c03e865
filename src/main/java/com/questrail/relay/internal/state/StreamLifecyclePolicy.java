package com.questrail.relay.internal.state;

import com.questrail.relay.api.StreamPeerId;
import com.questrail.relay.internal.events.AcceptFailed;
import com.questrail.relay.internal.events.ConnectionAccepted;
import com.questrail.relay.internal.events.PeerRead;
import com.questrail.relay.internal.events.ReadResult;
import com.questrail.relay.internal.events.ReceiveFailed;
import com.questrail.relay.internal.events.RelayEvent;
import com.questrail.relay.internal.events.TerminationRequested;
import com.questrail.relay.membership.MembershipView;

import java.util.Objects;

/**
 * StreamLifecyclePolicy
 * -----------------------------------------------------------------------------
 * Membership rules for the connection-oriented variant.
 *
 * <table border="1">
 *   <caption>Stream decisions</caption>
 *   <tr><th>Event</th><th>Peer state</th><th>Decision</th></tr>
 *   <tr><td>accept</td><td>UNKNOWN</td><td>admit (UNKNOWN → ACTIVE)</td></tr>
 *   <tr><td>accept</td><td>ACTIVE</td><td>anomaly, no-op</td></tr>
 *   <tr><td>accept failed</td><td>-</td><td>report, continue</td></tr>
 *   <tr><td>data (len &gt; 0)</td><td>ACTIVE</td><td>broadcast</td></tr>
 *   <tr><td>zero-length / EOF</td><td>ACTIVE</td><td>evict (ACTIVE → REMOVED)</td></tr>
 *   <tr><td>read failure</td><td>ACTIVE</td><td>report, evict</td></tr>
 *   <tr><td>any read</td><td>not a member</td><td>ignored (already removed)</td></tr>
 * </table>
 */
public final class StreamLifecyclePolicy implements LifecyclePolicy<StreamPeerId>
{
    @Override
    public Result apply(MembershipView<StreamPeerId> members, RelayEvent event)
    {
        Objects.requireNonNull(members, "members");
        Objects.requireNonNull(event, "event");

        if (event instanceof ConnectionAccepted e) {
            return onAccepted(members, e);
        }
        if (event instanceof AcceptFailed e) {
            return Result.of(RelayIntents.failure("Error accepting connection", e.cause()));
        }
        if (event instanceof PeerRead<?> e && e.peer() instanceof StreamPeerId peer) {
            return onRead(members, peer, e.result());
        }
        if (event instanceof ReceiveFailed e) {
            return Result.of(RelayIntents.failure("Error receiving", e.cause()));
        }
        if (event instanceof TerminationRequested) {
            return Result.of(RelayIntents.stop());
        }

        return Result.of(RelayIntents.anomaly("Unexpected event for stream relay: " + event));
    }

    private Result onAccepted(MembershipView<StreamPeerId> members, ConnectionAccepted e)
    {
        StreamPeerId peer = e.peer();
        if (members.contains(peer)) {
            // accept() never hands out a live handle twice.
            return Result.of(RelayIntents.anomaly("Accepted " + peer.describe() + " which is already a member"));
        }
        return Result.of(
                RelayIntents.admit(peer),
                new Transition(peer, PeerLifecycle.UNKNOWN, PeerLifecycle.ACTIVE));
    }

    private Result onRead(MembershipView<StreamPeerId> members, StreamPeerId peer, ReadResult result)
    {
        if (!members.contains(peer)) {
            // Close notifications that trail an eviction land here.
            return Result.of(RelayIntents.none());
        }

        Transition removal = new Transition(peer, PeerLifecycle.ACTIVE, PeerLifecycle.REMOVED);

        if (result instanceof ReadResult.Failure failure) {
            return Result.of(
                    RelayIntents.failure("Error receiving message from " + peer.describe(), failure.cause())
                            .and(RelayIntents.evict(peer)),
                    removal);
        }
        if (result instanceof ReadResult.Data data && !data.isEmpty()) {
            return Result.of(
                    RelayIntents.broadcast(peer, data.payload()),
                    new Transition(peer, PeerLifecycle.ACTIVE, PeerLifecycle.ACTIVE));
        }

        // End of stream, or an empty read which means the same thing on a stream.
        return Result.of(RelayIntents.evict(peer), removal);
    }
}
