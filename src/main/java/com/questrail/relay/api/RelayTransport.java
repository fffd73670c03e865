package com.questrail.relay.api;

/**
 * Transport variant a relay server runs on.
 */
public enum RelayTransport
{
    /** Connection-oriented variant; peers are accepted connections. */
    TCP,

    /** Connectionless variant; peers are sender addresses. */
    UDP
}
