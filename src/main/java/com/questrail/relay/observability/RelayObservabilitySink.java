package com.questrail.relay.observability;

import com.questrail.relay.internal.exec.BroadcastReport;

/**
 * Main interface for receiving relay observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Everything the operator sees (joins, leaves, busy peers, failures) flows
 * through here. None of it is part of the wire protocol.</p>
 */
public interface RelayObservabilitySink {
    /**
     * Called when a peer joins or leaves the membership set.
     * @param event the membership change
     */
    void onMembershipChange(MembershipChangeEvent event);

    /**
     * Called after every fan-out with its per-peer outcome.
     * @param report the broadcast report
     */
    void onBroadcast(BroadcastReport<?> report);

    /**
     * Called when a single delivery was dropped (peer busy) or failed.
     * @param event the delivery issue
     */
    void onDeliveryIssue(DeliveryIssueEvent event);

    /**
     * Called when the endpoint comes up or goes down.
     * @param event the transport event
     */
    void onTransportEvent(RelayTransportEvent event);

    /**
     * Called for protocol anomalies that are logged and otherwise ignored.
     * @param event the anomaly
     */
    void onAnomaly(RelayAnomalyEvent event);

    /**
     * Called when an error occurs (accept, receive or send failure).
     * @param event the error event
     */
    void onError(RelayErrorEvent event);
}
