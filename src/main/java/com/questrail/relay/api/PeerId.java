package com.questrail.relay.api;

/**
 * PeerId
 * -----------------------------------------------------------------------------
 * Identity of a broadcast recipient tracked by the relay.
 *
 * <p>Two concrete identities exist, one per transport variant:</p>
 * <ul>
 *   <li>{@link StreamPeerId}: an opaque handle for one accepted connection</li>
 *   <li>{@link DatagramPeerId}: the exact sender address of a datagram</li>
 * </ul>
 *
 * <p>Identities are immutable value objects. Everything above the transport
 * adapters works with these types only; no socket or channel objects leak
 * through this boundary.</p>
 */
public sealed interface PeerId permits StreamPeerId, DatagramPeerId
{
    /**
     * Short operator-facing description (e.g. {@code "socket 3 (/10.0.0.7:51234)"}).
     */
    String describe();
}
