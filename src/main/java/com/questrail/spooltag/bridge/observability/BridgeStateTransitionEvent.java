package com.questrail.spooltag.bridge.observability;

import com.questrail.spooltag.bridge.internal.events.BridgeEvent;
import com.questrail.spooltag.bridge.internal.state.BridgeIntents;
import com.questrail.spooltag.bridge.internal.state.BridgeSessionState;

import java.time.Duration;
import java.time.Instant;

/**
 * Record representing one reducer step of the bridge session.
 */
public record BridgeStateTransitionEvent(
    Instant timestamp,
    BridgeSessionState oldState,
    BridgeSessionState newState,
    BridgeEvent triggeringEvent,
    BridgeIntents resultingIntents
) {
    public boolean isConnectionChange() {
        return oldState.connection() != newState.connection();
    }

    public boolean isPhaseChange() {
        return oldState.phase() != newState.phase();
    }

    /** How long the session sat in {@code oldState} before this step. */
    public Duration timeInPreviousState() {
        Duration d = Duration.between(oldState.lastTransitionAt(), timestamp);
        return d.isNegative() ? Duration.ZERO : d;
    }
}
