package com.questrail.spooltag.bridge.internal.events;

import com.questrail.spooltag.bridge.model.BridgeMessage;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Events carrying inbound traffic after the decode boundary.
 */
public sealed interface BridgeMessageEvent extends BridgeEvent
        permits BridgeMessageEvent.MessageReceived, BridgeMessageEvent.MalformedMessageReceived
{
    /** A fully decoded message. */
    final class MessageReceived extends BridgeEvent.Base implements BridgeMessageEvent {
        private final BridgeMessage message;

        public MessageReceived(Instant timestamp, BridgeMessage message) {
            super(timestamp);
            this.message = Objects.requireNonNull(message, "message");
        }

        public BridgeMessage message() {
            return message;
        }
    }

    /**
     * An envelope that failed to decode but named a request id. Only such
     * envelopes become events; uncorrelated garbage is dropped at the adapter.
     */
    final class MalformedMessageReceived extends BridgeEvent.Base implements BridgeMessageEvent {
        private final String requestId;
        private final String detail;

        public MalformedMessageReceived(Instant timestamp, String requestId, String detail) {
            super(timestamp);
            this.requestId = requestId;
            this.detail = Objects.requireNonNull(detail, "detail");
        }

        public Optional<String> requestId() {
            return Optional.ofNullable(requestId);
        }

        public String detail() {
            return detail;
        }
    }
}
