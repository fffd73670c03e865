package com.questrail.relay.observability;

import com.questrail.relay.internal.exec.BroadcastReport;

/**
 * No-op implementation of RelayObservabilitySink.
 */
public final class NullObservabilitySink implements RelayObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onMembershipChange(MembershipChangeEvent event) {}

    @Override
    public void onBroadcast(BroadcastReport<?> report) {}

    @Override
    public void onDeliveryIssue(DeliveryIssueEvent event) {}

    @Override
    public void onTransportEvent(RelayTransportEvent event) {}

    @Override
    public void onAnomaly(RelayAnomalyEvent event) {}

    @Override
    public void onError(RelayErrorEvent event) {}
}
