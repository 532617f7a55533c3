package com.questrail.spooltag.bridge.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements BridgeObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onStateTransition(BridgeStateTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onProtocolViolation(BridgeProtocolViolationEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onTransportEvent(BridgeTransportObservabilityEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(BridgeErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<BridgeStateTransitionEvent> getStateTransitions() {
        return ofType(BridgeStateTransitionEvent.class);
    }

    public synchronized List<BridgeProtocolViolationEvent> getViolations() {
        return ofType(BridgeProtocolViolationEvent.class);
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }

    private <T> List<T> ofType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }
}
