package com.questrail.relay.internal.exec;

import com.questrail.relay.api.PeerId;
import com.questrail.relay.internal.events.RelayEvent;
import com.questrail.relay.internal.state.LifecyclePolicy;
import com.questrail.relay.internal.state.PeerLifecycle;
import com.questrail.relay.internal.state.RelayIntents;
import com.questrail.relay.membership.MembershipSet;
import com.questrail.relay.membership.MembershipView;
import com.questrail.relay.membership.ReadinessSet;
import com.questrail.relay.observability.MembershipChangeEvent;
import com.questrail.relay.observability.NullObservabilitySink;
import com.questrail.relay.observability.RelayAnomalyEvent;
import com.questrail.relay.observability.RelayErrorEvent;
import com.questrail.relay.observability.RelayObservabilitySink;
import com.questrail.relay.transport.PeerSender;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * MessageRouter
 * =============================================================================
 * Owner of the membership set and executor of lifecycle decisions.
 *
 * <h2>Execution model</h2>
 * <pre>
 *   RelayEvent → LifecyclePolicy → RelayIntents → MessageRouter
 *                                                   ├─ MembershipSet (admit / evict)
 *                                                   ├─ ReadinessTracker (rebuild)
 *                                                   └─ BroadcastFanout (send)
 * </pre>
 *
 * <p>The router is confined to the event loop thread. It holds no locks; the
 * membership set is mutated only here, between readiness wake-ups.</p>
 *
 * <h2>Ordering</h2>
 * <ul>
 *   <li>Membership changes are applied, and the readiness set rebuilt, before
 *       any broadcast for the same event.</li>
 *   <li>A broadcast happens strictly after the read that triggered it and
 *       visits members in insertion order.</li>
 * </ul>
 *
 * <p>The router has no network dependency: tests drive it with events and a
 * fake {@link PeerSender}.</p>
 */
public final class MessageRouter<P extends PeerId>
{
    private final Class<P> peerType;
    private final MembershipSet<P> members;
    private final LifecyclePolicy<P> policy;
    private final BroadcastFanout<P> fanout;
    private final ReadinessTracker<P> readiness;
    private final RelayObservabilitySink sink;
    private final Runnable stopAction;
    private final boolean reportDuplicateAdmits;
    private final Clock clock;

    private boolean stopped;

    private MessageRouter(Builder<P> b)
    {
        this.peerType = b.peerType;
        this.members = b.members;
        this.policy = b.policy;
        this.sink = b.sink;
        this.clock = b.clock;
        this.fanout = new BroadcastFanout<>(b.sender, b.sink, b.clock);
        this.readiness = new ReadinessTracker<>(b.sources, b.readinessApplier);
        this.stopAction = b.stopAction;
        this.reportDuplicateAdmits = b.reportDuplicateAdmits;
    }

    /**
     * Derives and applies the initial readiness set. Call once, before the
     * first event.
     */
    public ReadinessSet<P> open()
    {
        return readiness.rebuild(members);
    }

    /**
     * Routes one event.
     */
    public RoutingResult<P> route(RelayEvent event)
    {
        Objects.requireNonNull(event, "event");
        if (stopped) {
            return RoutingResult.ignored();
        }

        LifecyclePolicy.Result decision = policy.apply(members, event);
        RelayIntents intents = decision.intents();
        BroadcastReport<P> report = null;

        for (RelayIntents.Kind kind : intents.kinds()) {
            switch (kind) {
                case ADMIT_PEER -> admit(target(intents));
                case EVICT_PEER -> evict(target(intents));
                case BROADCAST -> report = broadcast(intents);
                case REPORT_ANOMALY -> sink.onAnomaly(new RelayAnomalyEvent(
                        Instant.now(clock), intents.detail().orElse("unspecified anomaly")));
                case REPORT_FAILURE -> sink.onError(new RelayErrorEvent(
                        Instant.now(clock), intents.detail().orElse("unspecified failure"), intents.cause().orElse(null)));
                case STOP -> stop();
            }
        }

        return new RoutingResult<>(intents, decision.transition(), Optional.ofNullable(report));
    }

    public MembershipView<P> members()
    {
        return members;
    }

    /**
     * Readiness set currently applied to the endpoint.
     */
    public ReadinessSet<P> readiness()
    {
        return readiness.current();
    }

    public boolean isStopped()
    {
        return stopped;
    }

    // -------------------------------------------------------------------------
    // Intent execution
    // -------------------------------------------------------------------------

    private void admit(P peer)
    {
        MembershipSet.InsertOutcome outcome = members.insert(peer);
        if (outcome == MembershipSet.InsertOutcome.ALREADY_PRESENT) {
            if (reportDuplicateAdmits) {
                sink.onAnomaly(new RelayAnomalyEvent(Instant.now(clock),
                        "Duplicate insert of " + peer.describe()));
            }
            return;
        }
        readiness.rebuild(members);
        sink.onMembershipChange(new MembershipChangeEvent(
                Instant.now(clock), peer, PeerLifecycle.UNKNOWN, PeerLifecycle.ACTIVE, members.size()));
    }

    private void evict(P peer)
    {
        if (members.remove(peer) == MembershipSet.RemoveOutcome.NOT_FOUND) {
            return;
        }
        readiness.rebuild(members);
        sink.onMembershipChange(new MembershipChangeEvent(
                Instant.now(clock), peer, PeerLifecycle.ACTIVE, PeerLifecycle.REMOVED, members.size()));
    }

    private BroadcastReport<P> broadcast(RelayIntents intents)
    {
        P origin = target(intents);
        byte[] payload = intents.payload().orElseThrow();
        BroadcastReport<P> report = fanout.fanOut(origin, payload, members);
        sink.onBroadcast(report);
        return report;
    }

    private void stop()
    {
        stopped = true;
        stopAction.run();
    }

    private P target(RelayIntents intents)
    {
        PeerId peer = intents.peer()
                .orElseThrow(() -> new IllegalStateException("Intent without target peer: " + intents));
        return peerType.cast(peer);
    }

    // -------------------------------------------------------------------------
    // Builder
    // -------------------------------------------------------------------------

    public static <P extends PeerId> Builder<P> builder(Class<P> peerType)
    {
        return new Builder<>(peerType);
    }

    public static final class Builder<P extends PeerId>
    {
        private final Class<P> peerType;
        private final MembershipSet<P> members = new MembershipSet<>();
        private LifecyclePolicy<P> policy;
        private PeerSender<P> sender;
        private Set<ReadinessSet.Source> sources = EnumSet.of(ReadinessSet.Source.TERMINATION);
        private Consumer<ReadinessSet<P>> readinessApplier = r -> {};
        private RelayObservabilitySink sink = NullObservabilitySink.INSTANCE;
        private Runnable stopAction = () -> {};
        private boolean reportDuplicateAdmits;
        private Clock clock = Clock.systemUTC();

        private Builder(Class<P> peerType)
        {
            this.peerType = Objects.requireNonNull(peerType, "peerType");
        }

        public Builder<P> withPolicy(LifecyclePolicy<P> policy) {
            this.policy = policy;
            return this;
        }

        public Builder<P> withSender(PeerSender<P> sender) {
            this.sender = sender;
            return this;
        }

        /**
         * Fixed, non-peer sources of the variant (listener or datagram socket,
         * plus termination).
         */
        public Builder<P> withSources(Set<ReadinessSet.Source> sources) {
            this.sources = sources;
            return this;
        }

        /**
         * Receives every rebuilt readiness set; typically the endpoint.
         */
        public Builder<P> withReadinessApplier(Consumer<ReadinessSet<P>> applier) {
            this.readinessApplier = applier;
            return this;
        }

        public Builder<P> withObservabilitySink(RelayObservabilitySink sink) {
            this.sink = sink;
            return this;
        }

        public Builder<P> withStopAction(Runnable stopAction) {
            this.stopAction = stopAction;
            return this;
        }

        /**
         * Whether inserting an already-present peer is reported as an anomaly
         * (stream variant) or silently idempotent (datagram variant).
         */
        public Builder<P> withDuplicateAdmitsReported(boolean report) {
            this.reportDuplicateAdmits = report;
            return this;
        }

        public Builder<P> withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public MessageRouter<P> build() {
            Objects.requireNonNull(policy, "policy");
            Objects.requireNonNull(sender, "sender");
            Objects.requireNonNull(sources, "sources");
            Objects.requireNonNull(readinessApplier, "readinessApplier");
            Objects.requireNonNull(sink, "sink");
            Objects.requireNonNull(stopAction, "stopAction");
            Objects.requireNonNull(clock, "clock");
            return new MessageRouter<>(this);
        }
    }
}
