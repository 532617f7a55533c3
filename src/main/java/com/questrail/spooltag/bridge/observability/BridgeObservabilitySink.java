package com.questrail.spooltag.bridge.observability;

/**
 * Receives bridge session observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface BridgeObservabilitySink {
    /**
     * Called after every event the session core processes.
     * @param event the transition event details
     */
    void onStateTransition(BridgeStateTransitionEvent event);

    /**
     * Called when an inbound message is dropped (undecodable, uncorrelated, late).
     * @param event the violation details
     */
    void onProtocolViolation(BridgeProtocolViolationEvent event);

    /**
     * Called when the channel to the agent opens, closes or schedules a reconnect.
     * @param event the transport event
     */
    void onTransportEvent(BridgeTransportObservabilityEvent event);

    /**
     * Called when an error escapes event processing or intent execution.
     * @param event the error event
     */
    void onError(BridgeErrorEvent event);
}
