package com.questrail.relay.membership;

import com.questrail.relay.api.PeerId;

import java.util.List;
import java.util.function.Consumer;

/**
 * Read-only view of a {@link MembershipSet}.
 *
 * <p>This is what the lifecycle policy is allowed to see. It cannot mutate
 * membership; only the router applies changes.</p>
 */
public interface MembershipView<P extends PeerId>
{
    boolean contains(P peer);

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Visits every member in insertion order.
     */
    void forEach(Consumer<? super P> action);

    /**
     * Immutable copy of the current members in insertion order.
     */
    List<P> snapshot();
}
