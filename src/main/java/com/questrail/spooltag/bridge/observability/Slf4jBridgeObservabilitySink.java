package com.questrail.spooltag.bridge.observability;

import com.questrail.spooltag.bridge.internal.state.BridgeIntents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of BridgeObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jBridgeObservabilitySink implements BridgeObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jBridgeObservabilitySink.class);

    @Override
    public void onStateTransition(BridgeStateTransitionEvent event) {
        if (event.isConnectionChange()) {
            log.info("Bridge connection: {} -> {} after {} ms",
                event.oldState().connection(),
                event.newState().connection(),
                event.timeInPreviousState().toMillis());
        }

        if (event.isPhaseChange()) {
            log.info("Bridge phase: {} -> {} ({}) after {} ms",
                event.oldState().phase(),
                event.newState().phase(),
                event.triggeringEvent().getClass().getSimpleName(),
                event.timeInPreviousState().toMillis());
        }

        event.resultingIntents().first(BridgeIntents.NotifyTagDetected.class)
            .ifPresent(tag -> log.info("Tag detected: uid={}", tag.uid()));

        if (log.isDebugEnabled() && !event.resultingIntents().isEmpty()) {
            log.debug("Bridge intents: {}", event.resultingIntents());
        }
    }

    @Override
    public void onProtocolViolation(BridgeProtocolViolationEvent event) {
        log.warn("Bridge message dropped: {}", event.detail());
    }

    @Override
    public void onTransportEvent(BridgeTransportObservabilityEvent event) {
        log.info("Bridge transport {}: {}", event.kind(), event.detail());
    }

    @Override
    public void onError(BridgeErrorEvent event) {
        log.error("Bridge error: {}", event.message(), event.cause());
    }
}
