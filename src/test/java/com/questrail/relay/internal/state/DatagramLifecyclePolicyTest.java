package com.questrail.relay.internal.state;

import com.questrail.relay.api.DatagramPeerId;
import com.questrail.relay.internal.events.ConnectionAccepted;
import com.questrail.relay.internal.events.PeerRead;
import com.questrail.relay.internal.events.ReadResult;
import com.questrail.relay.internal.events.ReceiveFailed;
import com.questrail.relay.internal.events.TerminationRequested;
import com.questrail.relay.api.StreamPeerId;
import com.questrail.relay.membership.MembershipSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Set;

import static com.questrail.relay.internal.state.RelayIntents.Kind.*;
import static org.junit.jupiter.api.Assertions.*;

class DatagramLifecyclePolicyTest {

    private DatagramLifecyclePolicy policy;
    private MembershipSet<DatagramPeerId> members;
    private DatagramPeerId p;
    private Instant now;

    @BeforeEach
    void setUp() {
        policy = new DatagramLifecyclePolicy();
        members = new MembershipSet<>();
        p = DatagramPeerId.of(new InetSocketAddress("127.0.0.1", 7001));
        now = Instant.now();
    }

    private LifecyclePolicy.Result read(byte[] payload) {
        return policy.apply(members, new PeerRead<>(now, p, ReadResult.data(payload)));
    }

    @Test
    void firstDatagramAdmitsThenBroadcasts() {
        LifecyclePolicy.Result result = read("ping".getBytes(StandardCharsets.US_ASCII));

        assertEquals(Set.of(ADMIT_PEER, BROADCAST), result.intents().kinds());
        assertEquals(PeerLifecycle.UNKNOWN, result.transition().orElseThrow().from());
        assertEquals(PeerLifecycle.ACTIVE, result.transition().orElseThrow().to());
    }

    @Test
    void datagramFromMemberOnlyBroadcasts() {
        members.insert(p);

        LifecyclePolicy.Result result = read(new byte[] {1, 2, 3});

        assertEquals(Set.of(BROADCAST), result.intents().kinds());
    }

    @Test
    void emptyDatagramFromMemberIsALeave() {
        members.insert(p);

        LifecyclePolicy.Result result = read(new byte[0]);

        assertEquals(Set.of(EVICT_PEER), result.intents().kinds());
        assertEquals(PeerLifecycle.REMOVED, result.transition().orElseThrow().to());
    }

    @Test
    void emptyDatagramFromUnknownSenderIsAnAnomaly() {
        LifecyclePolicy.Result result = read(new byte[0]);

        assertEquals(Set.of(REPORT_ANOMALY), result.intents().kinds());
        assertTrue(result.transition().isEmpty());
    }

    @Test
    void receiveFailureNeverEvicts() {
        members.insert(p);

        LifecyclePolicy.Result failed = policy.apply(members, new ReceiveFailed(now, new IOException("ICMP")));
        LifecyclePolicy.Result peerFailed = policy.apply(members,
            new PeerRead<>(now, p, ReadResult.failure(new IOException("truncated"))));

        assertEquals(Set.of(REPORT_FAILURE), failed.intents().kinds());
        assertEquals(Set.of(REPORT_FAILURE), peerFailed.intents().kinds());
    }

    @Test
    void endOfStreamMakesNoSenseForDatagrams() {
        members.insert(p);

        LifecyclePolicy.Result result = policy.apply(members, new PeerRead<>(now, p, ReadResult.endOfStream()));

        assertEquals(Set.of(REPORT_ANOMALY), result.intents().kinds());
    }

    @Test
    void streamEventsAreAnomalies() {
        LifecyclePolicy.Result result = policy.apply(members, new ConnectionAccepted(now, StreamPeerId.of(1)));

        assertEquals(Set.of(REPORT_ANOMALY), result.intents().kinds());
    }

    @Test
    void terminationStops() {
        assertEquals(Set.of(STOP), policy.apply(members, new TerminationRequested(now)).intents().kinds());
    }
}
