package com.questrail.spooltag.agent;

import com.questrail.spooltag.bridge.internal.decode.BridgeMessageDecoder;
import com.questrail.spooltag.bridge.internal.decode.ProtocolViolationException;
import com.questrail.spooltag.bridge.internal.encode.BridgeMessageEncoder;
import com.questrail.spooltag.bridge.model.AgentError;
import com.questrail.spooltag.bridge.model.AgentMessage;
import com.questrail.spooltag.bridge.model.AgentStatus;
import com.questrail.spooltag.bridge.model.BridgeMessage;
import com.questrail.spooltag.bridge.model.BridgeRequest;
import com.questrail.spooltag.bridge.model.ReadTagRequest;
import com.questrail.spooltag.bridge.model.TagData;
import com.questrail.spooltag.bridge.model.TagDetected;
import com.questrail.spooltag.bridge.model.WriteResult;
import com.questrail.spooltag.bridge.model.WriteTagRequest;
import com.questrail.spooltag.bridge.transport.MessageChannel;
import com.questrail.spooltag.bridge.transport.MessageChannelListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * BridgeAgent
 * =============================================================================
 * Reader-side end of the bridge: owns the tag hardware and answers the
 * session's requests.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>On connect, announces itself with {@code STATUS}.</li>
 *   <li>A {@code READ_TAG} or {@code WRITE_TAG} is remembered until a tag is
 *       presented. A newer request replaces an older one.</li>
 *   <li>Every presented tag is announced with {@code TAG_DETECTED}. If a
 *       request is waiting, exactly one operation runs on the hardware
 *       executor, never on the message-receive path, and the reply echoes the
 *       request id.</li>
 *   <li>A write asking for a uid rewrite on hardware that cannot do it gets
 *       {@code WRITE_RESULT} with {@code success=false}.</li>
 *   <li>A tag lost mid-operation gets {@code ERROR} with the request id.</li>
 * </ul>
 */
public final class BridgeAgent implements MessageChannelListener
{
    private static final Logger log = LoggerFactory.getLogger(BridgeAgent.class);

    static final String UID_REWRITE_UNSUPPORTED = "unsupported operation: reader cannot rewrite tag uid";

    private final MessageChannel channel;
    private final TagOperations operations;
    private final AgentConfig config;
    private final Executor hardwareExecutor;
    private final BridgeMessageDecoder decoder;
    private final BridgeMessageEncoder encoder;

    private final AtomicReference<BridgeRequest> waiting = new AtomicReference<>();

    public BridgeAgent(MessageChannel channel, AgentConfig config, Executor hardwareExecutor)
    {
        this(channel, config, new TagOperations(config), hardwareExecutor,
                new BridgeMessageDecoder(), new BridgeMessageEncoder());
    }

    public BridgeAgent(MessageChannel channel,
                       AgentConfig config,
                       TagOperations operations,
                       Executor hardwareExecutor,
                       BridgeMessageDecoder decoder,
                       BridgeMessageEncoder encoder)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.config = Objects.requireNonNull(config, "config");
        this.operations = Objects.requireNonNull(operations, "operations");
        this.hardwareExecutor = Objects.requireNonNull(hardwareExecutor, "hardwareExecutor");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.encoder = Objects.requireNonNull(encoder, "encoder");

        this.channel.setListener(this);
    }

    public void start() {
        channel.start();
    }

    public void stop() {
        channel.stop();
    }

    /** The request waiting for a tag, if any. */
    public Optional<BridgeRequest> waitingRequest() {
        return Optional.ofNullable(waiting.get());
    }

    /**
     * Called by the reader integration when a tag enters the field.
     */
    public void onTagPresented(MifareClassicTag tag)
    {
        Objects.requireNonNull(tag, "tag");
        reply(new TagDetected(tag.uid()));

        BridgeRequest request = waiting.getAndSet(null);
        if (request == null) {
            return;
        }

        try {
            hardwareExecutor.execute(() -> perform(request, tag));
        } catch (RejectedExecutionException e) {
            log.error("Hardware executor rejected request {}", request.requestId(), e);
            reply(new AgentError("agent shutting down", Optional.of(request.requestId())));
        }
    }

    // -------------------------------------------------------------------------
    // MessageChannelListener
    // -------------------------------------------------------------------------

    @Override
    public void onChannelUp() {
        log.info("Initiator connected");
        reply(new AgentStatus(true, config.deviceName()));
    }

    @Override
    public void onChannelDown(Throwable cause) {
        BridgeRequest dropped = waiting.getAndSet(null);
        if (dropped != null) {
            log.info("Initiator disconnected, dropping request {}", dropped.requestId());
        }
    }

    @Override
    public void onMessage(String text) {
        final BridgeMessage message;
        try {
            message = decoder.decode(text);
        } catch (ProtocolViolationException e) {
            log.warn("Dropping malformed request: {}", e.getMessage());
            e.requestId().ifPresent(id -> reply(new AgentError(e.getMessage(), Optional.of(id))));
            return;
        }

        if (message instanceof BridgeRequest request) {
            BridgeRequest previous = waiting.getAndSet(request);
            if (previous != null) {
                log.debug("Request {} replaced by {}", previous.requestId(), request.requestId());
            }
            log.info("Waiting for tag: {} {}", request.action(), request.requestId());
        }
        else {
            log.warn("Ignoring {} sent to agent", message.action());
        }
    }

    // -------------------------------------------------------------------------

    private void perform(BridgeRequest request, MifareClassicTag tag)
    {
        try {
            if (request instanceof ReadTagRequest read) {
                TagOperations.ReadOutcome outcome = operations.read(tag, read.keys());
                reply(new TagData(tag.uid(), outcome.image().blocks(), read.requestId(), outcome.readability()));
            }
            else if (request instanceof WriteTagRequest write) {
                reply(write(write, tag));
            }
        } catch (IOException e) {
            log.warn("Tag {} lost during {}: {}", tag.uid(), request.action(), e.getMessage());
            reply(new AgentError("tag I/O failed: " + e.getMessage(), Optional.of(request.requestId())));
        } catch (RuntimeException e) {
            // The request was already taken off the waiting slot: answer it or it is lost.
            log.error("{} {} failed on tag {}", request.action(), request.requestId(), tag.uid(), e);
            reply(new AgentError("agent failure: " + e, Optional.of(request.requestId())));
        }
    }

    private WriteResult write(WriteTagRequest write, MifareClassicTag tag) throws IOException
    {
        if (write.targetUid().isPresent()) {
            if (!tag.supportsUidRewrite()) {
                return new WriteResult(false, 0, Optional.of(UID_REWRITE_UNSUPPORTED), write.requestId());
            }
            tag.rewriteUid(write.targetUid().get());
        }
        int written = operations.write(tag, write.keys(), write.blocks());
        return new WriteResult(true, written, Optional.empty(), write.requestId());
    }

    private void reply(AgentMessage message)
    {
        if (!channel.send(encoder.encode(message))) {
            log.warn("Initiator not connected, {} not delivered", message.action());
        }
    }
}
