package com.questrail.relay.client;

import com.questrail.relay.api.RelayTransport;
import com.questrail.relay.config.RelayCommandLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Interactive relay client:
 *
 * <pre>
 *   relay-client [--tcp | --udp] &lt;host name&gt; &lt;port number&gt;
 * </pre>
 *
 * <p>Sends each line read from standard input (newline included) and prints
 * every message the relay delivers. An empty line or end of input ends the
 * session.</p>
 */
public final class RelayClientMain {
    private static final Logger log = LoggerFactory.getLogger(RelayClientMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private RelayClientMain() {}

    /**
     * Parsed command line.
     */
    record Options(RelayTransport transport, InetSocketAddress server) {

        static Options parse(String... args) {
            RelayTransport transport = RelayTransport.TCP;
            List<String> positional = new ArrayList<>();
            for (String arg : args) {
                switch (arg) {
                    case "--tcp" -> transport = RelayTransport.TCP;
                    case "--udp" -> transport = RelayTransport.UDP;
                    default -> {
                        if (arg.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown option: " + arg);
                        }
                        positional.add(arg);
                    }
                }
            }
            if (positional.size() != 2) {
                throw new IllegalArgumentException("Expected a host name and a port number");
            }
            int port = RelayCommandLine.parsePort(positional.get(1));
            return new Options(transport, new InetSocketAddress(positional.get(0), port));
        }
    }

    static String usage() {
        return "Usage:  relay-client [--tcp | --udp] <host name> <port number>";
    }

    public static void main(String[] args) {
        System.exit(run(System.in, System.out, args));
    }

    static int run(InputStream stdin, PrintStream stdout, String... args) {
        final Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(usage());
            return EXIT_FAILURE;
        }

        stdout.println("Trying " + options.server() + "...");
        try (RelayClient client = RelayClient.open(options.transport(), options.server(),
                payload -> stdout.print("Received: " + new String(payload, StandardCharsets.UTF_8)))) {
            stdout.println("Enter messages to send [empty message exits]:");
            BufferedReader reader = new BufferedReader(new InputStreamReader(stdin, StandardCharsets.UTF_8));
            String line;
            while ((line = reader.readLine()) != null && !line.isEmpty() && client.isOpen()) {
                client.send((line + "\n").getBytes(StandardCharsets.UTF_8));
            }
            client.leave();
            return EXIT_OK;
        } catch (IOException e) {
            log.error("Relay session with {} failed", options.server(), e);
            return EXIT_FAILURE;
        }
    }
}
