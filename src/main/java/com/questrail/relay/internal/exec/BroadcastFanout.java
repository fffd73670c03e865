package com.questrail.relay.internal.exec;

import com.questrail.relay.api.PeerId;
import com.questrail.relay.membership.MembershipView;
import com.questrail.relay.observability.DeliveryIssueEvent;
import com.questrail.relay.observability.RelayObservabilitySink;
import com.questrail.relay.transport.PeerSender;
import com.questrail.relay.transport.SendOutcome;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * BroadcastFanout
 * -----------------------------------------------------------------------------
 * Best-effort, non-blocking delivery of one payload to every member.
 *
 * <h2>Policy</h2>
 * <ul>
 *   <li>Exactly one send attempt per member, in membership order, sender
 *       included.</li>
 *   <li>A member whose outbound buffer is full loses this one delivery. The
 *       payload is never queued or retried.</li>
 *   <li>A failed send is reported and does not stop the remaining
 *       attempts. Send outcomes never change membership.</li>
 * </ul>
 *
 * <p>Resilience comes entirely from isolating each peer's outcome from the
 * others; one slow or broken peer never stalls the loop.</p>
 */
public final class BroadcastFanout<P extends PeerId>
{
    private final PeerSender<P> sender;
    private final RelayObservabilitySink sink;
    private final Clock clock;

    public BroadcastFanout(PeerSender<P> sender, RelayObservabilitySink sink, Clock clock)
    {
        this.sender = Objects.requireNonNull(sender, "sender");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public BroadcastReport<P> fanOut(P origin, byte[] payload, MembershipView<P> members)
    {
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(members, "members");

        List<P> delivered = new ArrayList<>();
        List<P> dropped = new ArrayList<>();
        List<P> failed = new ArrayList<>();

        for (P peer : members.snapshot()) {
            SendOutcome outcome = attempt(peer, payload);
            switch (outcome.status()) {
                case SENT -> delivered.add(peer);
                case WOULD_BLOCK -> dropped.add(peer);
                case FAILED -> failed.add(peer);
            }
            if (!outcome.isSent()) {
                sink.onDeliveryIssue(new DeliveryIssueEvent(Instant.now(clock), peer, outcome));
            }
        }

        return new BroadcastReport<>(Instant.now(clock), origin, payload.length, delivered, dropped, failed);
    }

    private SendOutcome attempt(P peer, byte[] payload)
    {
        try {
            SendOutcome outcome = sender.trySend(peer, payload);
            return outcome != null ? outcome : SendOutcome.failed(new IllegalStateException("sender returned null"));
        } catch (RuntimeException e) {
            // A throwing sender is one failed delivery, not a failed broadcast.
            return SendOutcome.failed(e);
        }
    }
}
