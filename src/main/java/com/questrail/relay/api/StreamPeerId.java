package com.questrail.relay.api;

import java.net.SocketAddress;
import java.util.Objects;

/**
 * Opaque handle for one accepted stream connection.
 *
 * <p>Equality is by {@code handle} only. The remote address is carried for
 * display and never participates in identity: two connections from the same
 * remote address are two different peers.</p>
 *
 * <p>Handles are allocated by the stream endpoint and are never reused for the
 * lifetime of a server instance.</p>
 */
public final class StreamPeerId implements PeerId
{
    private final long handle;
    private final SocketAddress remote;

    public StreamPeerId(long handle, SocketAddress remote)
    {
        if (handle < 0) {
            throw new IllegalArgumentException("handle must be >= 0");
        }
        this.handle = handle;
        this.remote = remote;
    }

    public static StreamPeerId of(long handle)
    {
        return new StreamPeerId(handle, null);
    }

    public long handle()
    {
        return handle;
    }

    /**
     * Remote address of the connection, or {@code null} if unknown.
     */
    public SocketAddress remote()
    {
        return remote;
    }

    @Override
    public String describe()
    {
        return remote == null
                ? "socket " + handle
                : "socket " + handle + " (" + remote + ")";
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StreamPeerId other)) {
            return false;
        }
        return handle == other.handle;
    }

    @Override
    public int hashCode()
    {
        return Objects.hashCode(handle);
    }

    @Override
    public String toString()
    {
        return describe();
    }
}
