package com.questrail.relay.membership;

import com.questrail.relay.api.PeerId;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * MembershipSet
 * =============================================================================
 * The authoritative, ordered collection of peers that receive broadcasts.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>A peer appears at most once. Inserting a present peer is a no-op.</li>
 *   <li>Removing an absent peer is a no-op and is never an error: a peer that
 *       already left is a valid end state.</li>
 *   <li>Iteration order is insertion order, which keeps broadcasts
 *       deterministic for tests.</li>
 * </ul>
 *
 * <h2>Representation</h2>
 * A hash-indexed linked set: O(1) average insert, lookup and removal while
 * preserving insertion order.
 *
 * <h2>Threading</h2>
 * Not thread-safe. A set is owned by exactly one event loop thread and is
 * mutated only between readiness wake-ups.
 *
 * <p>Every successful mutation increments {@link #generation()}, which lets
 * the readiness tracker tell whether a readiness snapshot is stale.</p>
 */
public final class MembershipSet<P extends PeerId> implements MembershipView<P>
{
    public enum InsertOutcome {
        INSERTED,
        ALREADY_PRESENT
    }

    public enum RemoveOutcome {
        REMOVED,
        NOT_FOUND
    }

    private final LinkedHashSet<P> members = new LinkedHashSet<>();
    private long generation;

    /**
     * Appends {@code peer} if it is not already a member.
     */
    public InsertOutcome insert(P peer)
    {
        Objects.requireNonNull(peer, "peer");
        if (!members.add(peer)) {
            return InsertOutcome.ALREADY_PRESENT;
        }
        generation++;
        return InsertOutcome.INSERTED;
    }

    /**
     * Removes {@code peer} if present.
     */
    public RemoveOutcome remove(P peer)
    {
        Objects.requireNonNull(peer, "peer");
        if (!members.remove(peer)) {
            return RemoveOutcome.NOT_FOUND;
        }
        generation++;
        return RemoveOutcome.REMOVED;
    }

    @Override
    public boolean contains(P peer)
    {
        return peer != null && members.contains(peer);
    }

    @Override
    public int size()
    {
        return members.size();
    }

    /**
     * Visits a snapshot of the members, so {@code action} may safely cause
     * membership changes without disturbing the traversal.
     */
    @Override
    public void forEach(Consumer<? super P> action)
    {
        Objects.requireNonNull(action, "action");
        for (P peer : snapshot()) {
            action.accept(peer);
        }
    }

    @Override
    public List<P> snapshot()
    {
        return List.copyOf(members);
    }

    /**
     * Number of successful mutations applied so far.
     */
    public long generation()
    {
        return generation;
    }

    @Override
    public String toString()
    {
        return "MembershipSet" + members;
    }
}
