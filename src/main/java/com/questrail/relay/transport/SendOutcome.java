package com.questrail.relay.transport;

import java.util.Objects;

/**
 * Result of one non-blocking send attempt to one peer.
 *
 * <ul>
 *   <li>{@link Status#SENT}: handed to the transport without blocking</li>
 *   <li>{@link Status#WOULD_BLOCK}: the peer's outbound buffer is full; the
 *       delivery is dropped, never queued or retried</li>
 *   <li>{@link Status#FAILED}: any other failure; {@link #cause()} says why</li>
 * </ul>
 */
public record SendOutcome(Status status, Throwable cause)
{
    public enum Status {
        SENT,
        WOULD_BLOCK,
        FAILED
    }

    private static final SendOutcome SENT = new SendOutcome(Status.SENT, null);
    private static final SendOutcome WOULD_BLOCK = new SendOutcome(Status.WOULD_BLOCK, null);

    public SendOutcome {
        Objects.requireNonNull(status, "status");
        if (status == Status.FAILED && cause == null) {
            throw new IllegalArgumentException("FAILED outcome requires a cause");
        }
    }

    public static SendOutcome sent() {
        return SENT;
    }

    public static SendOutcome wouldBlock() {
        return WOULD_BLOCK;
    }

    public static SendOutcome failed(Throwable cause) {
        return new SendOutcome(Status.FAILED, Objects.requireNonNull(cause, "cause"));
    }

    public boolean isSent() {
        return status == Status.SENT;
    }
}
