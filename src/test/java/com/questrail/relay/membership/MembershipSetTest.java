package com.questrail.relay.membership;

import com.questrail.relay.api.StreamPeerId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MembershipSetTest {

    private MembershipSet<StreamPeerId> members;
    private StreamPeerId a;
    private StreamPeerId b;
    private StreamPeerId c;

    @BeforeEach
    void setUp() {
        members = new MembershipSet<>();
        a = StreamPeerId.of(1);
        b = StreamPeerId.of(2);
        c = StreamPeerId.of(3);
    }

    @Test
    void insertIsIdempotent() {
        assertEquals(MembershipSet.InsertOutcome.INSERTED, members.insert(a));
        assertEquals(MembershipSet.InsertOutcome.ALREADY_PRESENT, members.insert(a));

        assertEquals(1, members.size());
        assertEquals(1, members.generation());
    }

    @Test
    void removingAnAbsentPeerIsANoOp() {
        members.insert(a);

        assertEquals(MembershipSet.RemoveOutcome.NOT_FOUND, members.remove(b));
        assertEquals(List.of(a), members.snapshot());
        assertEquals(1, members.generation());
    }

    @Test
    void removeTwiceReportsNotFoundTheSecondTime() {
        members.insert(a);

        assertEquals(MembershipSet.RemoveOutcome.REMOVED, members.remove(a));
        assertEquals(MembershipSet.RemoveOutcome.NOT_FOUND, members.remove(a));
        assertTrue(members.isEmpty());
    }

    @Test
    void iterationFollowsInsertionOrder() {
        members.insert(c);
        members.insert(a);
        members.insert(b);
        members.remove(a);
        members.insert(a);

        assertEquals(List.of(c, b, a), members.snapshot());
    }

    @Test
    void forEachToleratesRemovalDuringTraversal() {
        members.insert(a);
        members.insert(b);
        members.insert(c);

        List<StreamPeerId> visited = new ArrayList<>();
        members.forEach(peer -> {
            visited.add(peer);
            members.remove(peer);
        });

        assertEquals(List.of(a, b, c), visited);
        assertTrue(members.isEmpty());
    }

    @Test
    void containsRejectsNullQuietly() {
        assertFalse(members.contains(null));
        assertThrows(NullPointerException.class, () -> members.insert(null));
    }
}
