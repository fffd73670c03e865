package com.questrail.relay.transport;

import com.questrail.relay.api.DatagramPeerId;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Connectionless relay endpoint: one bound socket, sends addressed per peer.
 *
 * <p>Implementations may be backed by Netty, java.nio, or a test harness.</p>
 */
public interface DatagramEndpoint extends RelayEndpoint<DatagramPeerId>
{
    /**
     * Register the listener that receives inbound datagrams.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(DatagramEndpointListener listener);
}
