package com.questrail.spooltag.bridge.internal.events;

import com.questrail.spooltag.bridge.internal.state.PendingRequest;

import java.time.Instant;
import java.util.Objects;

/**
 * Initiator-originated events.
 */
public sealed interface BridgeRequestEvent extends BridgeEvent
        permits BridgeRequestEvent.RequestSubmitted
{
    /**
     * The initiator asks for a tag operation. Whether it is accepted is the
     * reducer's decision.
     */
    final class RequestSubmitted extends BridgeEvent.Base implements BridgeRequestEvent {
        private final PendingRequest request;

        public RequestSubmitted(Instant timestamp, PendingRequest request) {
            super(timestamp);
            this.request = Objects.requireNonNull(request, "request");
        }

        public PendingRequest request() {
            return request;
        }
    }
}
