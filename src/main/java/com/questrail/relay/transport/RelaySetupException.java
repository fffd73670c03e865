package com.questrail.relay.transport;

/**
 * Thrown when an endpoint cannot be created, bound or put into listening
 * state.
 *
 * <p>Setup failures are fatal for the process and are never retried.</p>
 */
public class RelaySetupException extends RuntimeException
{
    public RelaySetupException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
