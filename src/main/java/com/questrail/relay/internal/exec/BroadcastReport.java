package com.questrail.relay.internal.exec;

import com.questrail.relay.api.PeerId;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one fan-out.
 *
 * <p>Every member present when the fan-out started appears in exactly one of
 * {@code delivered}, {@code dropped} or {@code failed}, in membership
 * order.</p>
 *
 * @param origin        peer whose read triggered the broadcast
 * @param payloadLength number of payload bytes sent to each member
 * @param delivered     members the payload was handed to
 * @param dropped       members whose outbound buffer was full
 * @param failed        members whose send failed for any other reason
 */
public record BroadcastReport<P extends PeerId>(
        Instant timestamp,
        P origin,
        int payloadLength,
        List<P> delivered,
        List<P> dropped,
        List<P> failed)
{
    public BroadcastReport {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(origin, "origin");
        delivered = List.copyOf(delivered);
        dropped = List.copyOf(dropped);
        failed = List.copyOf(failed);
    }

    /**
     * Number of send attempts, which equals the member count at fan-out time.
     */
    public int attempts()
    {
        return delivered.size() + dropped.size() + failed.size();
    }

    public boolean isComplete()
    {
        return dropped.isEmpty() && failed.isEmpty();
    }
}
