package com.questrail.spooltag.bridge.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the bridge session.
 */
public record BridgeErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
