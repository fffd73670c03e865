package com.questrail.relay.observability;

import com.questrail.relay.internal.exec.BroadcastReport;
import com.questrail.relay.transport.SendOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of RelayObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jRelayObservabilitySink implements RelayObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jRelayObservabilitySink.class);

    @Override
    public void onMembershipChange(MembershipChangeEvent event) {
        if (event.isJoin()) {
            log.info("Connected to {} ({} members)", event.peer().describe(), event.memberCount());
        } else if (event.isLeave()) {
            log.info("Disconnected from {} ({} members)", event.peer().describe(), event.memberCount());
        }
    }

    @Override
    public void onBroadcast(BroadcastReport<?> report) {
        log.info("Received {} bytes from {}; delivered to {} of {} members",
            report.payloadLength(),
            report.origin().describe(),
            report.delivered().size(),
            report.attempts());
    }

    @Override
    public void onDeliveryIssue(DeliveryIssueEvent event) {
        SendOutcome outcome = event.outcome();
        if (outcome.status() == SendOutcome.Status.WOULD_BLOCK) {
            log.warn("{} is busy; message dropped", event.peer().describe());
        } else {
            log.warn("Error sending message to {}", event.peer().describe(), outcome.cause());
        }
    }

    @Override
    public void onTransportEvent(RelayTransportEvent event) {
        switch (event.kind()) {
            case UP -> log.info("Relay listening on {}", event.address());
            case DOWN -> {
                if (event.cause() == null) {
                    log.info("Relay on {} stopped", event.address());
                } else {
                    log.error("Relay on {} went down", event.address(), event.cause());
                }
            }
        }
    }

    @Override
    public void onAnomaly(RelayAnomalyEvent event) {
        log.warn("Anomaly: {}", event.message());
    }

    @Override
    public void onError(RelayErrorEvent event) {
        log.error("{}", event.message(), event.cause());
    }
}
