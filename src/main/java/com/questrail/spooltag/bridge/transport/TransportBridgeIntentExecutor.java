package com.questrail.spooltag.bridge.transport;

import com.questrail.spooltag.bridge.BridgeRequestException;
import com.questrail.spooltag.bridge.TagReadResult;
import com.questrail.spooltag.bridge.WriteOutcome;
import com.questrail.spooltag.bridge.internal.events.BridgeEvent;
import com.questrail.spooltag.bridge.internal.events.BridgeTransportEvent;
import com.questrail.spooltag.bridge.internal.exec.BridgeIntentExecutor;
import com.questrail.spooltag.bridge.internal.exec.PendingCompletions;
import com.questrail.spooltag.bridge.internal.state.BridgeIntents;
import com.questrail.spooltag.bridge.internal.time.WallClock;
import com.questrail.spooltag.bridge.model.TagData;
import com.questrail.spooltag.bridge.observability.BridgeObservabilitySink;
import com.questrail.spooltag.bridge.observability.BridgeProtocolViolationEvent;
import com.questrail.spooltag.bridge.observability.NullObservabilitySink;
import com.questrail.spooltag.codec.FilamentTagDecoder;
import com.questrail.spooltag.model.FilamentRecord;
import com.questrail.spooltag.tag.TagImage;
import com.questrail.spooltag.tag.TagUid;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * TransportBridgeIntentExecutor
 * =============================================================================
 * Carries out reducer intents against the transport and the caller futures.
 *
 * <h2>Outbound wiring flow</h2>
 * <pre>
 *   BridgeEvent
 *      ↓
 *   BridgeStateReducer
 *      ↓ emits
 *   BridgeIntents
 *      ↓ consumed by
 *   TransportBridgeIntentExecutor   (this class)
 *      ↓ delegates to
 *   BridgeTransportAdapter.send(BridgeRequest)
 *      ↓
 *   MessageChannel.send(String)
 * </pre>
 *
 * <p>Completion intents resolve the futures held in {@link PendingCompletions}.
 * A read is decoded into a {@link FilamentRecord} here, outside the reducer.
 * A request the channel refuses is fed back as
 * {@link BridgeTransportEvent.SendFailed}.</p>
 */
public final class TransportBridgeIntentExecutor implements BridgeIntentExecutor
{
    private final BridgeTransportAdapter transport;
    private final PendingCompletions completions;
    private final FilamentTagDecoder recordDecoder;
    private final Consumer<BridgeEvent> eventSink;
    private final Consumer<TagUid> tagDetectedListener;
    private final WallClock wallClock;
    private final BridgeObservabilitySink observabilitySink;

    public TransportBridgeIntentExecutor(BridgeTransportAdapter transport,
                                         PendingCompletions completions,
                                         FilamentTagDecoder recordDecoder,
                                         Consumer<BridgeEvent> eventSink,
                                         Consumer<TagUid> tagDetectedListener,
                                         WallClock wallClock,
                                         BridgeObservabilitySink observabilitySink)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.completions = Objects.requireNonNull(completions, "completions");
        this.recordDecoder = Objects.requireNonNull(recordDecoder, "recordDecoder");
        this.eventSink = Objects.requireNonNull(eventSink, "eventSink");
        this.tagDetectedListener = Objects.requireNonNull(tagDetectedListener, "tagDetectedListener");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    @Override
    public void execute(BridgeIntents intents)
    {
        Objects.requireNonNull(intents, "intents");

        for (BridgeIntents.Intent intent : intents.intents()) {
            switch (intent.kind()) {
                case SEND_REQUEST -> send((BridgeIntents.SendRequest) intent);
                case COMPLETE_READ -> completeRead((BridgeIntents.CompleteRead) intent);
                case COMPLETE_WRITE -> {
                    BridgeIntents.CompleteWrite w = (BridgeIntents.CompleteWrite) intent;
                    completions.completeWrite(w.requestId(), new WriteOutcome(w.blocksWritten()));
                }
                case FAIL_REQUEST -> {
                    BridgeIntents.FailRequest f = (BridgeIntents.FailRequest) intent;
                    completions.fail(f.requestId(), new BridgeRequestException(f.reason(), f.detail()));
                }
                case NOTIFY_TAG_DETECTED ->
                        tagDetectedListener.accept(((BridgeIntents.NotifyTagDetected) intent).uid());
                case REPORT_VIOLATION -> observabilitySink.onProtocolViolation(new BridgeProtocolViolationEvent(
                        wallClock.now(), ((BridgeIntents.ReportViolation) intent).detail()));
            }
        }
    }

    private void send(BridgeIntents.SendRequest send) {
        if (!transport.send(send.request())) {
            eventSink.accept(new BridgeTransportEvent.SendFailed(wallClock.now(), send.request().requestId()));
        }
    }

    private void completeRead(BridgeIntents.CompleteRead read) {
        TagData data = read.data();
        final TagReadResult result;
        try {
            TagImage image = TagImage.of(data.blocks());
            result = new TagReadResult(data.uid(), image, data.readability(), recordDecoder.decode(image));
        } catch (RuntimeException e) {
            completions.fail(read.requestId(), new BridgeRequestException(
                    BridgeRequestException.Reason.MALFORMED_RESPONSE, "undecodable tag image: " + e.getMessage()));
            return;
        }
        completions.completeRead(read.requestId(), result);
    }
}
