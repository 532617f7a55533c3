package com.questrail.spooltag.bridge.internal.events;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Events originating from the transport layer. They describe channel
 * availability, not protocol correctness.
 */
public sealed interface BridgeTransportEvent extends BridgeEvent
        permits BridgeTransportEvent.TransportUp, BridgeTransportEvent.TransportDown, BridgeTransportEvent.SendFailed
{
    /** Channel became usable. */
    final class TransportUp extends BridgeEvent.Base implements BridgeTransportEvent {
        public TransportUp(Instant timestamp) {
            super(timestamp);
        }
    }

    /** Channel became unusable. The cause is diagnostic only. */
    final class TransportDown extends BridgeEvent.Base implements BridgeTransportEvent {
        private final Throwable cause;

        public TransportDown(Instant timestamp, Throwable cause) {
            super(timestamp);
            this.cause = cause;
        }

        public Optional<Throwable> cause() {
            return Optional.ofNullable(cause);
        }
    }

    /** A request could not be handed to the channel. */
    final class SendFailed extends BridgeEvent.Base implements BridgeTransportEvent {
        private final String requestId;

        public SendFailed(Instant timestamp, String requestId) {
            super(timestamp);
            this.requestId = Objects.requireNonNull(requestId, "requestId");
        }

        public String requestId() {
            return requestId;
        }
    }
}
