package com.questrail.relay.config;

import com.questrail.relay.api.RelayTransport;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parses the relay server command line:
 *
 * <pre>
 *   relay-server [--tcp | --udp] &lt;port&gt;
 * </pre>
 *
 * <p>The transport defaults to TCP. Malformed input raises
 * {@link IllegalArgumentException}; callers print {@link #usage()} and exit
 * with a failure status.</p>
 */
public final class RelayCommandLine {

    private RelayCommandLine() {}

    public static RelayServerConfig parse(String... args) {
        Objects.requireNonNull(args, "args");

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

        if (positional.size() != 1) {
            throw new IllegalArgumentException("Expected exactly one port number");
        }

        return RelayServerConfig.builder()
            .withTransport(transport)
            .withPort(parsePort(positional.get(0)))
            .build();
    }

    /**
     * Parses a decimal port number in the range 0-65535.
     */
    public static int parsePort(String text) {
        final int port;
        try {
            port = Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a port number: " + text, e);
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Port must be 0-65535: " + text);
        }
        return port;
    }

    public static String usage() {
        return "Usage:  relay-server [--tcp | --udp] <port number>";
    }
}
