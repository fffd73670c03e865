package com.questrail.relay.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Routes INT and TERM to a termination callback for as long as the relay runs.
 *
 * <p>{@link #install(Runnable)} replaces the current handlers and remembers
 * them; {@link #close()} puts them back, so the process leaves the loop with
 * the signal disposition it started with. Where a signal cannot be handled
 * directly, a JVM shutdown hook requests termination instead.</p>
 */
final class TerminationSignals implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TerminationSignals.class);

    private static final List<String> SIGNALS = List.of("INT", "TERM");

    private final Map<sun.misc.Signal, sun.misc.SignalHandler> previous = new LinkedHashMap<>();
    private Thread shutdownHook;

    private TerminationSignals() {}

    static TerminationSignals install(Runnable onSignal) {
        Objects.requireNonNull(onSignal, "onSignal");
        TerminationSignals signals = new TerminationSignals();

        sun.misc.SignalHandler handler = sig -> {
            log.info("Received SIG{}; shutting down", sig.getName());
            onSignal.run();
        };

        for (String name : SIGNALS) {
            try {
                sun.misc.Signal signal = new sun.misc.Signal(name);
                signals.previous.put(signal, sun.misc.Signal.handle(signal, handler));
            } catch (IllegalArgumentException e) {
                log.debug("Cannot handle SIG{} directly: {}", name, e.getMessage());
            }
        }

        if (signals.previous.size() < SIGNALS.size()) {
            signals.shutdownHook = new Thread(onSignal, "relay-shutdown");
            Runtime.getRuntime().addShutdownHook(signals.shutdownHook);
        }
        return signals;
    }

    @Override
    public void close() {
        previous.forEach(sun.misc.Signal::handle);
        previous.clear();

        Thread hook = shutdownHook;
        shutdownHook = null;
        if (hook != null) {
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                // The JVM is already shutting down and the hook is running.
                log.debug("Shutdown in progress; hook left in place");
            }
        }
    }
}
