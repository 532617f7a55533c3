package com.questrail.spooltag.bridge.observability;

import com.questrail.spooltag.bridge.internal.events.BridgeTransportEvent;
import com.questrail.spooltag.bridge.internal.state.BridgeIntents;
import com.questrail.spooltag.bridge.internal.state.BridgeSessionState;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

final class BridgeStateTransitionEventTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void timeInPreviousStateRunsFromTheLastTransition() {
        BridgeSessionState disconnected = BridgeSessionState.initial(T0);
        Instant upAt = T0.plusMillis(2_500);
        BridgeSessionState connected = disconnected.withConnection(BridgeSessionState.Connection.CONNECTED, upAt);

        BridgeStateTransitionEvent event = new BridgeStateTransitionEvent(
                upAt, disconnected, connected, new BridgeTransportEvent.TransportUp(upAt), BridgeIntents.none());

        assertTrue(event.isConnectionChange());
        assertFalse(event.isPhaseChange());
        assertEquals(Duration.ofMillis(2_500), event.timeInPreviousState());
    }

    @Test
    void timeInPreviousStateNeverGoesNegative() {
        BridgeSessionState later = BridgeSessionState.initial(T0.plusSeconds(10));

        BridgeStateTransitionEvent event = new BridgeStateTransitionEvent(
                T0, later, later, new BridgeTransportEvent.TransportUp(T0), BridgeIntents.none());

        assertEquals(Duration.ZERO, event.timeInPreviousState());
    }
}
