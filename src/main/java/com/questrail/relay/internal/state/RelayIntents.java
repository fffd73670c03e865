package com.questrail.relay.internal.state;

import com.questrail.relay.api.PeerId;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * RelayIntents
 * -----------------------------------------------------------------------------
 * Immutable set of actions emitted by a {@link LifecyclePolicy}.
 *
 * <h2>Role in the architecture</h2>
 * The policy decides <b>what</b> should happen for an event; the
 * {@link com.questrail.relay.internal.exec.MessageRouter} decides <b>how</b>.
 * No intent performs I/O on its own.
 *
 * <h2>Execution order</h2>
 * Kinds are executed in declaration order. In particular {@link Kind#ADMIT_PEER}
 * runs before {@link Kind#BROADCAST}, so a datagram sender that is new to the
 * set receives the broadcast of its own first message.
 */
public final class RelayIntents
{
    public enum Kind {
        /** Insert the target peer into the membership set. */
        ADMIT_PEER,

        /** Remove the target peer from the membership set. */
        EVICT_PEER,

        /** Fan the payload out to every member. */
        BROADCAST,

        /** Report a protocol anomaly to the operator; no state change. */
        REPORT_ANOMALY,

        /** Report a per-peer or per-endpoint failure to the operator. */
        REPORT_FAILURE,

        /** Leave the event loop. */
        STOP
    }

    private static final RelayIntents NONE = new RelayIntents(EnumSet.noneOf(Kind.class), null, null, null, null);

    private final Set<Kind> kinds;
    private final PeerId peer;
    private final byte[] payload;
    private final String detail;
    private final Throwable cause;

    private RelayIntents(Set<Kind> kinds, PeerId peer, byte[] payload, String detail, Throwable cause)
    {
        this.kinds = kinds.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(kinds));
        this.peer = peer;
        this.payload = payload;
        this.detail = detail;
        this.cause = cause;
    }

    public Set<Kind> kinds() {
        return kinds;
    }

    public boolean isEmpty() {
        return kinds.isEmpty();
    }

    /**
     * Peer targeted by admit/evict/broadcast intents.
     */
    public Optional<PeerId> peer() {
        return Optional.ofNullable(peer);
    }

    /**
     * Payload to broadcast. Present only with {@link Kind#BROADCAST}.
     */
    public Optional<byte[]> payload() {
        return Optional.ofNullable(payload);
    }

    /**
     * Operator-facing description for anomaly and failure reports.
     */
    public Optional<String> detail() {
        return Optional.ofNullable(detail);
    }

    public Optional<Throwable> cause() {
        return Optional.ofNullable(cause);
    }

    // ---------------------------------------------------------------------
    // Factory methods
    // ---------------------------------------------------------------------

    public static RelayIntents none() {
        return NONE;
    }

    public static RelayIntents admit(PeerId peer) {
        return builder().add(Kind.ADMIT_PEER).peer(peer).build();
    }

    public static RelayIntents evict(PeerId peer) {
        return builder().add(Kind.EVICT_PEER).peer(peer).build();
    }

    public static RelayIntents broadcast(PeerId origin, byte[] payload) {
        return builder().add(Kind.BROADCAST).peer(origin).payload(payload).build();
    }

    public static RelayIntents anomaly(String detail) {
        return builder().add(Kind.REPORT_ANOMALY).detail(detail).build();
    }

    public static RelayIntents failure(String detail, Throwable cause) {
        return builder().add(Kind.REPORT_FAILURE).detail(detail).cause(cause).build();
    }

    public static RelayIntents stop() {
        return builder().add(Kind.STOP).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final EnumSet<Kind> kinds = EnumSet.noneOf(Kind.class);
        private PeerId peer;
        private byte[] payload;
        private String detail;
        private Throwable cause;

        private Builder() {}

        public Builder add(Kind kind) {
            kinds.add(Objects.requireNonNull(kind, "kind"));
            return this;
        }

        public Builder peer(PeerId peer) {
            this.peer = Objects.requireNonNull(peer, "peer");
            return this;
        }

        public Builder payload(byte[] payload) {
            this.payload = Objects.requireNonNull(payload, "payload");
            return this;
        }

        public Builder detail(String detail) {
            this.detail = detail;
            return this;
        }

        public Builder cause(Throwable cause) {
            this.cause = cause;
            return this;
        }

        public RelayIntents build() {
            if (kinds.contains(Kind.BROADCAST) && payload == null) {
                throw new IllegalStateException("BROADCAST requires a payload");
            }
            if ((kinds.contains(Kind.ADMIT_PEER) || kinds.contains(Kind.EVICT_PEER)) && peer == null) {
                throw new IllegalStateException("ADMIT_PEER/EVICT_PEER require a target peer");
            }
            return new RelayIntents(kinds, peer, payload, detail, cause);
        }
    }

    // ---------------------------------------------------------------------
    // Composition
    // ---------------------------------------------------------------------

    /**
     * Combines two intent sets. Peer-targeted intents must agree on the peer.
     */
    public RelayIntents and(RelayIntents other)
    {
        Objects.requireNonNull(other, "other");

        if (peer != null && other.peer != null && !peer.equals(other.peer)) {
            throw new IllegalArgumentException("Cannot combine intents targeting different peers");
        }

        EnumSet<Kind> merged = kinds.isEmpty() ? EnumSet.noneOf(Kind.class) : EnumSet.copyOf(kinds);
        merged.addAll(other.kinds);

        return new RelayIntents(
                merged,
                peer != null ? peer : other.peer,
                payload != null ? payload : other.payload,
                detail != null ? detail : other.detail,
                cause != null ? cause : other.cause);
    }

    @Override
    public String toString()
    {
        return "RelayIntents" + kinds + (peer != null ? " peer=" + peer.describe() : "");
    }
}
