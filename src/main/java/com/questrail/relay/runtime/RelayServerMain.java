package com.questrail.relay.runtime;

import com.questrail.relay.config.RelayCommandLine;
import com.questrail.relay.config.RelayServerConfig;
import com.questrail.relay.observability.Slf4jRelayObservabilitySink;
import com.questrail.relay.transport.RelaySetupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * Command-line entry point:
 *
 * <pre>
 *   relay-server [--tcp | --udp] &lt;port number&gt;
 * </pre>
 *
 * <p>Exits with status 1 on a usage error or when the socket cannot be set
 * up, and with status 0 after a termination signal.</p>
 */
public final class RelayServerMain {
    private static final Logger log = LoggerFactory.getLogger(RelayServerMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private RelayServerMain() {}

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String... args) {
        return run(server -> {}, args);
    }

    /**
     * @param onStarted called once the relay is bound and the termination
     *                  signals are routed to it
     */
    static int run(Consumer<RelayServer> onStarted, String... args) {
        final RelayServerConfig config;
        try {
            config = RelayCommandLine.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(RelayCommandLine.usage());
            return EXIT_FAILURE;
        }

        RelayServer server = RelayServer.builder()
            .withConfig(config)
            .withObservabilitySink(new Slf4jRelayObservabilitySink())
            .build();

        try (TerminationSignals ignored = TerminationSignals.install(server::requestStop)) {
            try {
                server.start();
            } catch (RelaySetupException e) {
                log.error("Relay setup failed: {}", e.getMessage());
                return EXIT_FAILURE;
            }
            onStarted.accept(server);

            while (!server.awaitTermination(Duration.ofDays(1))) {
                log.debug("Relay on port {} still running", config.port());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            server.close();
        }

        log.info("Relay exited");
        return EXIT_OK;
    }
}
