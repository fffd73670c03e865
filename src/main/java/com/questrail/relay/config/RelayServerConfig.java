package com.questrail.relay.config;

import com.questrail.relay.api.RelayTransport;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Aggregated configuration for a relay server.
 *
 * @param transport                 stream (TCP) or datagram (UDP) variant
 * @param bindAddress               local address to bind; the wildcard IPv4
 *                                  address by default
 * @param receiveBufferSize         upper bound of one read, in bytes
 * @param backlog                   pending-connection backlog (TCP only)
 */
public record RelayServerConfig(
    RelayTransport transport,
    InetSocketAddress bindAddress,
    int receiveBufferSize,
    int backlog
) {
    public static final int DEFAULT_RECEIVE_BUFFER_SIZE = 1024;
    public static final int DEFAULT_BACKLOG = 10;

    public RelayServerConfig {
        Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(bindAddress, "bindAddress");
        if (receiveBufferSize <= 0) {
            throw new IllegalArgumentException("receiveBufferSize must be > 0");
        }
        if (backlog <= 0) {
            throw new IllegalArgumentException("backlog must be > 0");
        }
    }

    public int port() {
        return bindAddress.getPort();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private RelayTransport transport = RelayTransport.TCP;
        private InetSocketAddress bindAddress = new InetSocketAddress("0.0.0.0", 0);
        private int receiveBufferSize = DEFAULT_RECEIVE_BUFFER_SIZE;
        private int backlog = DEFAULT_BACKLOG;

        public Builder withTransport(RelayTransport transport) {
            this.transport = transport;
            return this;
        }

        /**
         * Binds the wildcard IPv4 address on {@code port}.
         */
        public Builder withPort(int port) {
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("Port must be 0-65535");
            }
            this.bindAddress = new InetSocketAddress("0.0.0.0", port);
            return this;
        }

        public Builder withBindAddress(InetSocketAddress address) {
            this.bindAddress = address;
            return this;
        }

        public Builder withReceiveBufferSize(int bytes) {
            this.receiveBufferSize = bytes;
            return this;
        }

        public Builder withBacklog(int backlog) {
            this.backlog = backlog;
            return this;
        }

        public RelayServerConfig build() {
            return new RelayServerConfig(
                transport,
                bindAddress,
                receiveBufferSize,
                backlog);
        }
    }
}
