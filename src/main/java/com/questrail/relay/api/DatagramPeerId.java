package com.questrail.relay.api;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.Objects;

/**
 * Sender address of a datagram, used as the peer identity of the datagram
 * variant.
 *
 * <p>Equality is an exact match of the raw address bytes and the port. There
 * is no normalisation: {@code 127.0.0.1} and {@code ::ffff:127.0.0.1} are
 * different peers when the socket reports them as different byte strings.</p>
 */
public final class DatagramPeerId implements PeerId
{
    private final byte[] address;
    private final int port;

    private DatagramPeerId(byte[] address, int port)
    {
        this.address = address;
        this.port = port;
    }

    /**
     * Builds an identity from a resolved socket address.
     *
     * @throws IllegalArgumentException if the address is unresolved or not an
     *                                  {@link InetSocketAddress}
     */
    public static DatagramPeerId of(SocketAddress remote)
    {
        Objects.requireNonNull(remote, "remote");
        if (!(remote instanceof InetSocketAddress inet)) {
            throw new IllegalArgumentException("Not an inet socket address: " + remote);
        }
        InetAddress ip = inet.getAddress();
        if (ip == null) {
            throw new IllegalArgumentException("Unresolved address: " + remote);
        }
        return new DatagramPeerId(ip.getAddress(), inet.getPort());
    }

    public int port()
    {
        return port;
    }

    /**
     * Returns a copy of the raw address bytes.
     */
    public byte[] addressBytes()
    {
        return address.clone();
    }

    /**
     * Converts back into a socket address usable as a send destination.
     */
    public InetSocketAddress toSocketAddress()
    {
        try {
            return new InetSocketAddress(InetAddress.getByAddress(address), port);
        } catch (UnknownHostException e) {
            // Only thrown for illegal address lengths, which of() never produces.
            throw new IllegalStateException("Invalid stored address", e);
        }
    }

    @Override
    public String describe()
    {
        return toSocketAddress().toString();
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DatagramPeerId other)) {
            return false;
        }
        return port == other.port && Arrays.equals(address, other.address);
    }

    @Override
    public int hashCode()
    {
        return 31 * Arrays.hashCode(address) + port;
    }

    @Override
    public String toString()
    {
        return describe();
    }
}
