package com.questrail.spooltag.bridge.transport;

import com.questrail.spooltag.bridge.internal.decode.BridgeMessageDecoder;
import com.questrail.spooltag.bridge.internal.decode.ProtocolViolationException;
import com.questrail.spooltag.bridge.internal.encode.BridgeMessageEncoder;
import com.questrail.spooltag.bridge.internal.events.BridgeEvent;
import com.questrail.spooltag.bridge.internal.events.BridgeMessageEvent;
import com.questrail.spooltag.bridge.internal.events.BridgeTransportEvent;
import com.questrail.spooltag.bridge.internal.time.WallClock;
import com.questrail.spooltag.bridge.model.BridgeMessage;
import com.questrail.spooltag.bridge.model.BridgeRequest;
import com.questrail.spooltag.bridge.observability.BridgeObservabilitySink;
import com.questrail.spooltag.bridge.observability.BridgeProtocolViolationEvent;
import com.questrail.spooltag.bridge.observability.BridgeTransportObservabilityEvent;
import com.questrail.spooltag.bridge.observability.NullObservabilitySink;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * BridgeTransportAdapter
 * =============================================================================
 * Translation layer between a {@link MessageChannel} and the session event loop.
 *
 * <h2>Inbound path (decode-before-event)</h2>
 * <pre>
 *   MessageChannel
 *        → BridgeMessageDecoder
 *            → BridgeMessageEvent.MessageReceived
 *                → event loop
 * </pre>
 *
 * <h2>Outbound path (executor-authoritative)</h2>
 * <pre>
 *   BridgeRequest
 *        → BridgeMessageEncoder
 *            → MessageChannel.send(...)
 * </pre>
 *
 * <h2>Invalid input</h2>
 * Envelopes that fail to decode are reported to observability and dropped.
 * The only exception is an envelope that still names a request id: it becomes
 * a {@link BridgeMessageEvent.MalformedMessageReceived} so the reducer can fail
 * that request instead of letting it time out.
 */
public final class BridgeTransportAdapter implements MessageChannelListener {

    private final MessageChannel channel;
    private final Consumer<BridgeEvent> eventSink;
    private final BridgeMessageDecoder decoder;
    private final BridgeMessageEncoder encoder;
    private final WallClock wallClock;
    private final BridgeObservabilitySink observabilitySink;

    public BridgeTransportAdapter(MessageChannel channel,
                                  Consumer<BridgeEvent> eventSink,
                                  BridgeMessageDecoder decoder,
                                  BridgeMessageEncoder encoder,
                                  WallClock wallClock,
                                  BridgeObservabilitySink observabilitySink) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.eventSink = Objects.requireNonNull(eventSink, "eventSink");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

        this.channel.setListener(this);
    }

    public void start() {
        channel.start();
    }

    public void stop() {
        channel.stop();
    }

    public boolean isOpen() {
        return channel.isOpen();
    }

    /**
     * Encode and send a request.
     *
     * @return {@code false} if the channel refused it
     */
    public boolean send(BridgeRequest request) {
        Objects.requireNonNull(request, "request");
        return channel.send(encoder.encode(request));
    }

    // -------------------------------------------------------------------------
    // MessageChannelListener
    // -------------------------------------------------------------------------

    @Override
    public void onChannelUp() {
        observabilitySink.onTransportEvent(new BridgeTransportObservabilityEvent(
                wallClock.now(), BridgeTransportObservabilityEvent.Kind.CHANNEL_UP, "agent connected"));
        eventSink.accept(new BridgeTransportEvent.TransportUp(wallClock.now()));
    }

    @Override
    public void onChannelDown(Throwable cause) {
        observabilitySink.onTransportEvent(new BridgeTransportObservabilityEvent(
                wallClock.now(), BridgeTransportObservabilityEvent.Kind.CHANNEL_DOWN,
                cause == null ? "closed" : String.valueOf(cause.getMessage())));
        eventSink.accept(new BridgeTransportEvent.TransportDown(wallClock.now(), cause));
    }

    @Override
    public void onMessage(String text) {
        Objects.requireNonNull(text, "text");

        final BridgeMessage message;
        try {
            message = decoder.decode(text);
        } catch (ProtocolViolationException e) {
            observabilitySink.onProtocolViolation(new BridgeProtocolViolationEvent(wallClock.now(), e.getMessage()));
            e.requestId().ifPresent(id -> eventSink.accept(
                    new BridgeMessageEvent.MalformedMessageReceived(wallClock.now(), id, e.getMessage())));
            return;
        }

        eventSink.accept(new BridgeMessageEvent.MessageReceived(wallClock.now(), message));
    }
}
