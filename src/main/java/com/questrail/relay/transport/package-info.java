/**
 * Relay Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete networking implementation (Netty TCP, Netty UDP, or a
 * test double) and the relay core.
 *
 * <p>Everything above an endpoint sees only:</p>
 * <ul>
 *   <li>Peer identities ({@code StreamPeerId}, {@code DatagramPeerId})</li>
 *   <li>Raw payloads as {@code byte[]}</li>
 *   <li>Non-blocking send outcomes ({@link com.questrail.relay.transport.SendOutcome})</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only</li>
 *   <li>Never block the event loop on a send</li>
 *   <li>Not decide membership or emit {@code RelayEvent} instances directly</li>
 * </ul>
 *
 * <p>Membership and broadcast behavior live in the lifecycle policy and the
 * message router.</p>
 */
package com.questrail.relay.transport;
