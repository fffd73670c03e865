package com.questrail.relay.internal.exec;

import com.questrail.relay.api.PeerId;
import com.questrail.relay.internal.state.LifecyclePolicy;
import com.questrail.relay.internal.state.RelayIntents;

import java.util.Objects;
import java.util.Optional;

/**
 * What the router did with one event.
 *
 * @param intents    intents the policy produced
 * @param transition lifecycle change that was applied, if any
 * @param broadcast  fan-out report, present if the event was broadcast
 */
public record RoutingResult<P extends PeerId>(
        RelayIntents intents,
        Optional<LifecyclePolicy.Transition> transition,
        Optional<BroadcastReport<P>> broadcast)
{
    public RoutingResult {
        Objects.requireNonNull(intents, "intents");
        Objects.requireNonNull(transition, "transition");
        Objects.requireNonNull(broadcast, "broadcast");
    }

    static <P extends PeerId> RoutingResult<P> ignored()
    {
        return new RoutingResult<>(RelayIntents.none(), Optional.empty(), Optional.empty());
    }
}
