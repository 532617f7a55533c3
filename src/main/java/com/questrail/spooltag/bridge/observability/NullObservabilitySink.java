package com.questrail.spooltag.bridge.observability;

/**
 * No-op implementation of BridgeObservabilitySink.
 */
public final class NullObservabilitySink implements BridgeObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(BridgeStateTransitionEvent event) {}

    @Override
    public void onProtocolViolation(BridgeProtocolViolationEvent event) {}

    @Override
    public void onTransportEvent(BridgeTransportObservabilityEvent event) {}

    @Override
    public void onError(BridgeErrorEvent event) {}
}
