package com.questrail.relay.transport;

import com.questrail.relay.api.PeerId;

/**
 * Outbound half of a relay endpoint: one best-effort, non-blocking send to one
 * peer.
 *
 * <p>Implementations MUST NOT block, queue beyond the transport's own bounded
 * outbound buffer, or retry. Failures are reported through the returned
 * {@link SendOutcome}; failures that surface only after the send was handed to
 * the transport are reported to the operator by the implementation.</p>
 */
@FunctionalInterface
public interface PeerSender<P extends PeerId>
{
    SendOutcome trySend(P peer, byte[] payload);
}
