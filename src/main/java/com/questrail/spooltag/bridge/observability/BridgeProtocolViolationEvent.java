package com.questrail.spooltag.bridge.observability;

import java.time.Instant;

/**
 * An inbound message that was dropped instead of resolving a request.
 */
public record BridgeProtocolViolationEvent(
    Instant timestamp,
    String detail
) {
}
