package com.questrail.relay.transport;

import com.questrail.relay.api.StreamPeerId;

/**
 * Connection-oriented relay endpoint (listener plus accepted connections).
 *
 * <p>The endpoint accepts at most one pending connection per readiness
 * wake-up and performs at most one bounded read per ready connection per
 * wake-up.</p>
 */
public interface StreamEndpoint extends RelayEndpoint<StreamPeerId>
{
    /**
     * Register the listener that receives accept/read notifications.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(StreamEndpointListener listener);
}
