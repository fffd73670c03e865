package com.questrail.relay.internal.exec;

import com.questrail.relay.api.PeerId;
import com.questrail.relay.membership.MembershipSet;
import com.questrail.relay.membership.ReadinessSet;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Keeps the watched-source set in step with membership.
 *
 * <p>{@link #rebuild(MembershipSet)} derives a fresh {@link ReadinessSet} and
 * pushes it to the endpoint synchronously, so the loop never waits on a stale
 * set. Every change triggers a full rebuild; there are no incremental
 * updates.</p>
 */
public final class ReadinessTracker<P extends PeerId>
{
    private final Set<ReadinessSet.Source> sources;
    private final Consumer<ReadinessSet<P>> applier;

    private ReadinessSet<P> current;

    public ReadinessTracker(Set<ReadinessSet.Source> sources, Consumer<ReadinessSet<P>> applier)
    {
        Objects.requireNonNull(sources, "sources");
        this.sources = sources.isEmpty() ? EnumSet.noneOf(ReadinessSet.Source.class) : EnumSet.copyOf(sources);
        this.applier = Objects.requireNonNull(applier, "applier");
    }

    public ReadinessSet<P> rebuild(MembershipSet<P> members)
    {
        ReadinessSet<P> next = ReadinessSet.derive(sources, members);
        current = next;
        applier.accept(next);
        return next;
    }

    /**
     * Most recently derived set, or {@code null} before the first rebuild.
     */
    public ReadinessSet<P> current()
    {
        return current;
    }
}
