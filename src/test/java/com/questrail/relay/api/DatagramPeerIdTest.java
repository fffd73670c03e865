package com.questrail.relay.api;

import org.junit.jupiter.api.Test;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;

import static org.junit.jupiter.api.Assertions.*;

class DatagramPeerIdTest {

    @Test
    void sameAddressAndPortAreTheSamePeer() {
        DatagramPeerId a = DatagramPeerId.of(new InetSocketAddress("127.0.0.1", 5000));
        DatagramPeerId b = DatagramPeerId.of(new InetSocketAddress("127.0.0.1", 5000));

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    void differentPortIsADifferentPeer() {
        DatagramPeerId a = DatagramPeerId.of(new InetSocketAddress("127.0.0.1", 5000));
        DatagramPeerId b = DatagramPeerId.of(new InetSocketAddress("127.0.0.1", 5001));

        assertNotEquals(a, b);
    }

    @Test
    void mappedIpv6AndIpv4AreNotNormalised() throws Exception {
        byte[] mapped = {0, 0, 0, 0, 0, 0, 0, 0, 0, 0, (byte) 0xff, (byte) 0xff, 127, 0, 0, 1};
        // getByAddress collapses mapped addresses, so build the Inet6Address explicitly.
        InetAddress v6 = Inet6Address.getByAddress(null, mapped, -1);
        DatagramPeerId v4Peer = DatagramPeerId.of(new InetSocketAddress("127.0.0.1", 5000));
        DatagramPeerId v6Peer = DatagramPeerId.of(new InetSocketAddress(v6, 5000));

        assertNotEquals(v4Peer, v6Peer);
    }

    @Test
    void roundTripsToSocketAddress() {
        InetSocketAddress address = new InetSocketAddress("127.0.0.1", 6000);
        DatagramPeerId peer = DatagramPeerId.of(address);

        assertEquals(address, peer.toSocketAddress());
        assertEquals(6000, peer.port());
    }

    @Test
    void addressBytesAreDefensivelyCopied() {
        DatagramPeerId peer = DatagramPeerId.of(new InetSocketAddress("127.0.0.1", 6000));
        peer.addressBytes()[0] = 10;

        assertEquals(127, peer.addressBytes()[0]);
    }

    @Test
    void rejectsUnresolvedAddress() {
        SocketAddress unresolved = InetSocketAddress.createUnresolved("relay.invalid", 5000);
        assertThrows(IllegalArgumentException.class, () -> DatagramPeerId.of(unresolved));
    }

    @Test
    void rejectsNonInetAddress() {
        SocketAddress other = new SocketAddress() {};
        assertThrows(IllegalArgumentException.class, () -> DatagramPeerId.of(other));
    }

    @Test
    void streamPeersCompareByHandleOnly() {
        StreamPeerId a = new StreamPeerId(7, new InetSocketAddress("127.0.0.1", 1));
        StreamPeerId b = new StreamPeerId(7, new InetSocketAddress("127.0.0.1", 2));
        StreamPeerId c = new StreamPeerId(8, new InetSocketAddress("127.0.0.1", 1));

        assertEquals(a, b);
        assertNotEquals(a, c);
        assertThrows(IllegalArgumentException.class, () -> StreamPeerId.of(-1));
    }
}
