package com.questrail.relay.internal.state;

import com.questrail.relay.api.PeerId;
import com.questrail.relay.internal.events.RelayEvent;
import com.questrail.relay.membership.MembershipView;

import java.util.Objects;
import java.util.Optional;

/**
 * LifecyclePolicy
 * -----------------------------------------------------------------------------
 * Pure decision function for peer membership.
 *
 * <p>Given a read-only view of the current members and a single
 * {@link RelayEvent}, a policy returns:</p>
 * <ul>
 *   <li>the lifecycle transition of the peer the event concerns, if any</li>
 *   <li>the {@link RelayIntents} the router must carry out</li>
 * </ul>
 *
 * <p>Policies perform no I/O and never mutate membership. The stream and
 * datagram variants differ only in their policy; the router is shared.</p>
 */
public interface LifecyclePolicy<P extends PeerId>
{
    /**
     * Lifecycle change of one peer.
     */
    record Transition(PeerId peer, PeerLifecycle from, PeerLifecycle to) {
        public Transition {
            Objects.requireNonNull(peer, "peer");
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
            if (!from.canTransitionTo(to)) {
                throw new IllegalArgumentException("Illegal transition " + from + " -> " + to);
            }
        }

        public boolean isChange() {
            return from != to;
        }
    }

    /**
     * @param intents    actions to execute, in {@link RelayIntents.Kind} order
     * @param transition lifecycle change of the concerned peer, if any
     */
    record Result(RelayIntents intents, Optional<Transition> transition) {
        public Result {
            Objects.requireNonNull(intents, "intents");
            Objects.requireNonNull(transition, "transition");
        }

        public static Result of(RelayIntents intents) {
            return new Result(intents, Optional.empty());
        }

        public static Result of(RelayIntents intents, Transition transition) {
            return new Result(intents, Optional.of(transition));
        }
    }

    Result apply(MembershipView<P> members, RelayEvent event);
}
