package com.questrail.spooltag.bridge.internal.events;

import java.time.Instant;
import java.util.Objects;

/**
 * Timer-originated events.
 */
public sealed interface BridgeTimeoutEvent extends BridgeEvent
        permits BridgeTimeoutEvent.RequestTimeout
{
    /**
     * The deadline of {@code requestId} elapsed. Stale timeouts (for a request
     * that already completed) are ignored by the reducer.
     */
    final class RequestTimeout extends BridgeEvent.Base implements BridgeTimeoutEvent {
        private final String requestId;

        public RequestTimeout(Instant timestamp, String requestId) {
            super(timestamp);
            this.requestId = Objects.requireNonNull(requestId, "requestId");
        }

        public String requestId() {
            return requestId;
        }
    }
}
