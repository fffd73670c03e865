package com.questrail.relay.runtime;

import com.questrail.relay.api.DatagramPeerId;
import com.questrail.relay.api.PeerId;
import com.questrail.relay.api.StreamPeerId;
import com.questrail.relay.config.RelayServerConfig;
import com.questrail.relay.internal.events.TerminationRequested;
import com.questrail.relay.internal.exec.MessageRouter;
import com.questrail.relay.internal.state.DatagramLifecyclePolicy;
import com.questrail.relay.internal.state.StreamLifecyclePolicy;
import com.questrail.relay.membership.ReadinessSet;
import com.questrail.relay.observability.NullObservabilitySink;
import com.questrail.relay.observability.RelayObservabilitySink;
import com.questrail.relay.transport.RelaySetupException;
import com.questrail.relay.transport.netty.NettyEventMultiplexer;
import com.questrail.relay.transport.tcp.TcpRelayAdapter;
import com.questrail.relay.transport.tcp.netty.NettyTcpStreamEndpoint;
import com.questrail.relay.transport.udp.UdpRelayAdapter;
import com.questrail.relay.transport.udp.netty.NettyUdpDatagramEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * RelayServer
 * =============================================================================
 * Composition root and lifecycle owner for one relay instance.
 *
 * <h2>Wiring</h2>
 * <pre>
 *   NettyEventMultiplexer (one loop)
 *        ├─ Netty endpoint (TCP listener + connections, or UDP socket)
 *        │      → TcpRelayAdapter / UdpRelayAdapter
 *        │            → MessageRouter (policy, membership, fan-out)
 *        └─ termination requests (queued loop tasks)
 * </pre>
 *
 * <p>No relay semantics live here. Membership, broadcast and lifecycle rules
 * belong to the router and its policy.</p>
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #start()} binds the endpoint. A bind or listen failure releases
 *       the loop and throws {@link RelaySetupException}.</li>
 *   <li>{@link #requestStop()} may be called from any thread, also before or
 *       during {@link #start()}. It queues a termination event onto the loop;
 *       the router closes the endpoint and shuts the loop down. A server
 *       stopped before it started never binds.</li>
 *   <li>{@link #awaitTermination(Duration)} blocks until the loop has
 *       exited.</li>
 * </ul>
 */
public final class RelayServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RelayServer.class);

    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

    private final RelayServerConfig config;
    private final NettyEventMultiplexer multiplexer;
    private final MessageRouter<? extends PeerId> router;
    private final Runnable bind;
    private final Supplier<SocketAddress> boundAddress;
    private final Clock clock;
    private final Object lifecycleLock = new Object();
    private boolean started;
    private boolean stopRequested;

    private volatile SocketAddress localAddress;

    private RelayServer(RelayServerConfig config,
                        NettyEventMultiplexer multiplexer,
                        MessageRouter<? extends PeerId> router,
                        Runnable bind,
                        Supplier<SocketAddress> boundAddress,
                        Clock clock) {
        this.config = config;
        this.multiplexer = multiplexer;
        this.router = router;
        this.bind = bind;
        this.boundAddress = boundAddress;
        this.clock = clock;
    }

    /**
     * Derives the initial readiness set and binds the endpoint.
     *
     * <p>Returns without binding if a stop was requested first. A stop
     * requested while the endpoint is being bound wins over a bind that fails
     * because the loop is already going down.</p>
     *
     * @throws RelaySetupException if the socket cannot be bound or put into
     *                             listening state
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (started) {
                throw new IllegalStateException("Relay server already started");
            }
            started = true;
            if (stopRequested) {
                multiplexer.shutdown();
                return;
            }
        }

        try {
            multiplexer.call(router::open);
            bind.run();
            localAddress = boundAddress.get();
        } catch (RuntimeException e) {
            boolean stopping;
            synchronized (lifecycleLock) {
                stopping = stopRequested;
                stopRequested = true;
            }
            multiplexer.shutdown();
            if (stopping) {
                log.debug("Relay stopped while starting: {}", e.getMessage());
                return;
            }
            throw e;
        }
    }

    /**
     * Queues a termination request onto the loop. Idempotent and safe to call
     * from any thread, including a signal handler.
     */
    public void requestStop() {
        synchronized (lifecycleLock) {
            if (stopRequested) {
                return;
            }
            stopRequested = true;
            if (!started) {
                // A later start() sees the request and does not bind.
                multiplexer.shutdown();
                return;
            }
        }
        if (multiplexer.isShuttingDown()) {
            return;
        }
        try {
            multiplexer.execute(() -> router.route(new TerminationRequested(Instant.now(clock))));
        } catch (RejectedExecutionException e) {
            log.debug("Loop already shutting down; termination request dropped");
        }
    }

    /**
     * @return {@code true} if the loop exited within {@code timeout}
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return multiplexer.awaitTermination(timeout);
    }

    public boolean isTerminated() {
        return multiplexer.isTerminated();
    }

    /**
     * Address the endpoint is bound to. Reports the actual port when the
     * configured port was 0.
     *
     * @throws IllegalStateException if the endpoint was never bound
     */
    public SocketAddress localAddress() {
        SocketAddress address = localAddress;
        if (address == null) {
            throw new IllegalStateException("Relay server is not started");
        }
        return address;
    }

    public RelayServerConfig config() {
        return config;
    }

    /**
     * Snapshot of the current members, in insertion order.
     */
    public List<PeerId> members() {
        if (multiplexer.isTerminated()) {
            return List.copyOf(router.members().snapshot());
        }
        return multiplexer.call(() -> List.copyOf(router.members().snapshot()));
    }

    /**
     * Readiness set currently applied to the endpoint.
     */
    public ReadinessSet<? extends PeerId> readiness() {
        if (multiplexer.isTerminated()) {
            return router.readiness();
        }
        return multiplexer.call(router::readiness);
    }

    @Override
    public void close() {
        requestStop();
        try {
            awaitTermination(CLOSE_TIMEOUT);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private RelayServerConfig config;
        private RelayObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private Clock clock = Clock.systemUTC();

        public Builder withConfig(RelayServerConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(RelayObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public RelayServer build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(clock, "clock");

            return switch (config.transport()) {
                case TCP -> buildTcp();
                case UDP -> buildUdp();
            };
        }

        private RelayServer buildTcp() {
            NettyEventMultiplexer multiplexer = new NettyEventMultiplexer("relay-tcp-" + config.port());
            NettyTcpStreamEndpoint endpoint = new NettyTcpStreamEndpoint(config, multiplexer, observabilitySink);

            MessageRouter<StreamPeerId> router = MessageRouter.builder(StreamPeerId.class)
                    .withPolicy(new StreamLifecyclePolicy())
                    .withSender(endpoint)
                    .withSources(EnumSet.of(ReadinessSet.Source.LISTENER, ReadinessSet.Source.TERMINATION))
                    .withReadinessApplier(endpoint::applyReadiness)
                    .withObservabilitySink(observabilitySink)
                    .withStopAction(() -> {
                        endpoint.stop();
                        multiplexer.shutdown();
                    })
                    .withDuplicateAdmitsReported(true)
                    .withClock(clock)
                    .build();

            TcpRelayAdapter adapter = new TcpRelayAdapter(router, endpoint, clock);
            return new RelayServer(config, multiplexer, router, adapter::start, endpoint::localAddress, clock);
        }

        private RelayServer buildUdp() {
            NettyEventMultiplexer multiplexer = new NettyEventMultiplexer("relay-udp-" + config.port());
            NettyUdpDatagramEndpoint endpoint = new NettyUdpDatagramEndpoint(config, multiplexer, observabilitySink);

            MessageRouter<DatagramPeerId> router = MessageRouter.builder(DatagramPeerId.class)
                    .withPolicy(new DatagramLifecyclePolicy())
                    .withSender(endpoint)
                    .withSources(EnumSet.of(ReadinessSet.Source.DATAGRAM_SOCKET, ReadinessSet.Source.TERMINATION))
                    .withReadinessApplier(endpoint::applyReadiness)
                    .withObservabilitySink(observabilitySink)
                    .withStopAction(() -> {
                        endpoint.stop();
                        multiplexer.shutdown();
                    })
                    .withClock(clock)
                    .build();

            UdpRelayAdapter adapter = new UdpRelayAdapter(router, endpoint, clock);
            return new RelayServer(config, multiplexer, router, adapter::start, endpoint::localAddress, clock);
        }
    }
}
