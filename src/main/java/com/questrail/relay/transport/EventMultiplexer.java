package com.questrail.relay.transport;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * EventMultiplexer
 * -----------------------------------------------------------------------------
 * The single-threaded readiness loop that every source of one relay shares:
 * the listening or datagram socket, every peer connection, and the
 * termination source.
 *
 * <p>Readiness is level-triggered and waits have no timeout. All relay state
 * is confined to the loop thread; other threads interact with it only by
 * submitting tasks.</p>
 */
public interface EventMultiplexer
{
    /**
     * Queues {@code task} onto the loop. The loop wakes up to run it, so a task
     * is observed with the same latency as socket readiness.
     */
    void execute(Runnable task);

    /**
     * Runs {@code task} once the I/O of the current loop iteration has been
     * processed. Used to order read results after accepts within one wake-up.
     * Must be called from the loop thread.
     */
    void executeAfterIo(Runnable task);

    /**
     * Runs {@code task} on the loop and waits for its result. Runs inline when
     * called from the loop thread.
     */
    <T> T call(Callable<T> task);

    boolean inLoop();

    /**
     * Stops the loop once pending tasks have run. Idempotent.
     */
    void shutdown();

    /**
     * Waits for the loop to terminate.
     *
     * @return {@code true} if the loop terminated within {@code timeout}
     */
    boolean awaitTermination(Duration timeout) throws InterruptedException;

    /**
     * {@code true} once {@link #shutdown()} was called; new tasks may be
     * rejected from then on.
     */
    boolean isShuttingDown();

    boolean isTerminated();
}
