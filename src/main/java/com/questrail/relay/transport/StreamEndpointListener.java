package com.questrail.relay.transport;

import com.questrail.relay.api.StreamPeerId;

/**
 * Callback sink for {@link StreamEndpoint}.
 *
 * <p>Callbacks are serialized on the event loop thread. Within one readiness
 * wake-up, {@link #onAccepted} is delivered before any read callback.</p>
 */
public interface StreamEndpointListener
{
    void onAccepted(StreamPeerId peer);

    void onAcceptFailed(Throwable cause);

    /**
     * One bounded read completed with at least one byte.
     */
    void onRead(StreamPeerId peer, byte[] payload);

    /**
     * Orderly shutdown by the peer, or the connection was closed.
     */
    void onEndOfStream(StreamPeerId peer);

    void onReadFailed(StreamPeerId peer, Throwable cause);
}
