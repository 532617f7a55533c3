package com.questrail.spooltag.bridge.observability;

import java.time.Instant;

/**
 * Transport lifecycle observation.
 */
public record BridgeTransportObservabilityEvent(
    Instant timestamp,
    Kind kind,
    String detail
) {
    public enum Kind {
        CHANNEL_UP,
        CHANNEL_DOWN,
        RECONNECT_SCHEDULED
    }
}
