package com.questrail.relay.internal.events;

import java.time.Instant;

/**
 * RelayEvent
 * -----------------------------------------------------------------------------
 * Marker interface for every stimulus the relay core reacts to.
 *
 * <h2>Role in the architecture</h2>
 * The relay is modeled as a single-threaded, event-driven loop. Transport
 * adapters translate readiness callbacks (accept completed, bytes read, end of
 * stream, receive failure) into {@code RelayEvent}s. The
 * {@link com.questrail.relay.internal.state.LifecyclePolicy} decides what each
 * event means; the {@link com.questrail.relay.internal.exec.MessageRouter}
 * carries the decision out.
 *
 * <p>Events are immutable and carry only what is needed to reach a decision.</p>
 */
public sealed interface RelayEvent
        permits ConnectionAccepted, AcceptFailed, PeerRead, ReceiveFailed, TerminationRequested
{
    /**
     * Time at which the event was observed by the transport adapter.
     */
    Instant timestamp();
}
