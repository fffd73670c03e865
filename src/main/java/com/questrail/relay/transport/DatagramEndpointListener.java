package com.questrail.relay.transport;

import com.questrail.relay.api.DatagramPeerId;

/**
 * Callback sink for {@link DatagramEndpoint}.
 *
 * <p>All callbacks are delivered in a serialized manner on the event loop
 * thread.</p>
 */
public interface DatagramEndpointListener
{
    /**
     * Called when a datagram is received.
     *
     * <p>The payload is delivered exactly as received, possibly empty. The
     * listener MUST treat it as an atomic unit; no streaming assumptions are
     * permitted at this boundary.</p>
     *
     * @param sender  exact sender address
     * @param payload raw datagram payload, truncated to the receive buffer size
     */
    void onDatagram(DatagramPeerId sender, byte[] payload);

    /**
     * Called when a receive fails without an attributable sender.
     */
    void onReceiveFailed(Throwable cause);
}
