package com.questrail.spooltag.bridge.internal.state;

import com.questrail.spooltag.bridge.BridgeRequestException.Reason;
import com.questrail.spooltag.bridge.internal.events.BridgeEvent;
import com.questrail.spooltag.bridge.internal.events.BridgeMessageEvent;
import com.questrail.spooltag.bridge.internal.events.BridgeRequestEvent;
import com.questrail.spooltag.bridge.internal.events.BridgeTimeoutEvent;
import com.questrail.spooltag.bridge.internal.events.BridgeTransportEvent;
import com.questrail.spooltag.bridge.model.AgentError;
import com.questrail.spooltag.bridge.model.AgentStatus;
import com.questrail.spooltag.bridge.model.BridgeMessage;
import com.questrail.spooltag.bridge.model.BridgeRequest;
import com.questrail.spooltag.bridge.model.TagData;
import com.questrail.spooltag.bridge.model.TagDetected;
import com.questrail.spooltag.bridge.model.WriteResult;
import com.questrail.spooltag.tag.TagGeometry;

import java.time.Instant;
import java.util.Objects;

/**
 * BridgeStateReducer
 * -----------------------------------------------------------------------------
 * Pure, deterministic state transition engine of the bridge session.
 *
 * <p>
 * It is intentionally:
 * <ul>
 *   <li>Pure (no I/O, no timers, no clocks)</li>
 *   <li>Deterministic</li>
 *   <li>Event-driven</li>
 * </ul>
 *
 * Given a prior {@link BridgeSessionState} and one {@link BridgeEvent}, the
 * reducer computes the next state and the {@link BridgeIntents} that carry the
 * consequences out.
 *
 * <h2>Protocol rules</h2>
 * <ul>
 *   <li>A request while disconnected fails with {@code NO_BRIDGE_CONNECTED}.</li>
 *   <li>A request while another is pending fails with {@code REQUEST_IN_PROGRESS};
 *       the pending one is untouched.</li>
 *   <li>A response resolves the pending request only if its id and kind match.
 *       Anything else is reported as a violation and dropped, so late responses
 *       to timed-out requests never reach a caller.</li>
 *   <li>Losing the transport fails the pending request immediately.</li>
 * </ul>
 */
public final class BridgeStateReducer
{
    /**
     * Result of applying an event to a session state.
     *
     * @param newState the updated state
     * @param intents  effects to be executed by the caller
     */
    public record Result(BridgeSessionState newState,
                         BridgeIntents intents) {}

    public Result apply(BridgeSessionState state, BridgeEvent event) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(event, "event");

        if (event instanceof BridgeTransportEvent.TransportUp e) {
            return onTransportUp(state, e);
        }
        if (event instanceof BridgeTransportEvent.TransportDown e) {
            return onTransportDown(state, e);
        }
        if (event instanceof BridgeTransportEvent.SendFailed e) {
            return onSendFailed(state, e);
        }
        if (event instanceof BridgeRequestEvent.RequestSubmitted e) {
            return onRequestSubmitted(state, e);
        }
        if (event instanceof BridgeMessageEvent.MessageReceived e) {
            return onMessageReceived(state, e);
        }
        if (event instanceof BridgeMessageEvent.MalformedMessageReceived e) {
            return onMalformedMessage(state, e);
        }
        if (event instanceof BridgeTimeoutEvent.RequestTimeout e) {
            return onRequestTimeout(state, e);
        }

        return new Result(state, BridgeIntents.none());
    }

    // ---------------------------------------------------------------------
    // Transport
    // ---------------------------------------------------------------------

    private Result onTransportUp(BridgeSessionState state, BridgeTransportEvent.TransportUp e) {
        return new Result(state.withConnection(BridgeSessionState.Connection.CONNECTED, e.timestamp()),
                BridgeIntents.none());
    }

    private Result onTransportDown(BridgeSessionState state, BridgeTransportEvent.TransportDown e) {
        BridgeSessionState down = state.withConnection(BridgeSessionState.Connection.DISCONNECTED, e.timestamp());
        if (state.pending().isEmpty()) {
            return new Result(down, BridgeIntents.none());
        }
        // Fail now rather than leaving the caller to time out.
        String id = state.pending().get().requestId();
        return new Result(down.withoutPending(e.timestamp()),
                BridgeIntents.of(new BridgeIntents.FailRequest(id, Reason.NO_BRIDGE_CONNECTED, "transport closed")));
    }

    private Result onSendFailed(BridgeSessionState state, BridgeTransportEvent.SendFailed e) {
        if (!state.isPending(e.requestId())) {
            return new Result(state, BridgeIntents.none());
        }
        return new Result(state.withoutPending(e.timestamp()),
                BridgeIntents.of(new BridgeIntents.FailRequest(e.requestId(), Reason.NO_BRIDGE_CONNECTED,
                        "request could not be sent")));
    }

    // ---------------------------------------------------------------------
    // Requests
    // ---------------------------------------------------------------------

    private Result onRequestSubmitted(BridgeSessionState state, BridgeRequestEvent.RequestSubmitted e) {
        PendingRequest request = e.request();

        if (!state.isConnected()) {
            return new Result(state, BridgeIntents.of(
                    new BridgeIntents.FailRequest(request.requestId(), Reason.NO_BRIDGE_CONNECTED, "no agent connected")));
        }
        if (state.pending().isPresent()) {
            return new Result(state, BridgeIntents.of(
                    new BridgeIntents.FailRequest(request.requestId(), Reason.REQUEST_IN_PROGRESS,
                            "request " + state.pending().get().requestId() + " is awaiting a tag")));
        }

        return new Result(state.withPending(request, e.timestamp()),
                BridgeIntents.of(new BridgeIntents.SendRequest(request.toMessage(), request.deadlineNanos())));
    }

    private Result onRequestTimeout(BridgeSessionState state, BridgeTimeoutEvent.RequestTimeout e) {
        // Stale guard: the request already completed or failed.
        if (!state.isPending(e.requestId())) {
            return new Result(state, BridgeIntents.none());
        }
        PendingRequest p = state.pending().get();
        return new Result(state.withoutPending(e.timestamp()),
                BridgeIntents.of(new BridgeIntents.FailRequest(p.requestId(), Reason.TIMEOUT,
                        "no tag within " + p.timeout())));
    }

    // ---------------------------------------------------------------------
    // Agent messages
    // ---------------------------------------------------------------------

    private Result onMessageReceived(BridgeSessionState state, BridgeMessageEvent.MessageReceived e) {
        BridgeMessage message = e.message();
        Instant now = e.timestamp();

        if (message instanceof AgentStatus m) {
            return new Result(state.withAgentDevice(m.device(), now), BridgeIntents.none());
        }
        if (message instanceof TagDetected m) {
            return new Result(state.withLastDetectedUid(m.uid(), now),
                    BridgeIntents.of(new BridgeIntents.NotifyTagDetected(m.uid())));
        }
        if (message instanceof TagData m) {
            return onTagData(state, m, now);
        }
        if (message instanceof WriteResult m) {
            return onWriteResult(state, m, now);
        }
        if (message instanceof AgentError m) {
            return onAgentError(state, m, now);
        }
        if (message instanceof BridgeRequest m) {
            return violation(state, "agent sent a request (" + m.action() + ")");
        }
        return new Result(state, BridgeIntents.none());
    }

    private Result onTagData(BridgeSessionState state, TagData m, Instant now) {
        if (!matchesPending(state, m.requestId(), RequestKind.READ)) {
            return violation(state, "unmatched TAG_DATA for request " + m.requestId());
        }
        BridgeSessionState idle = state.withoutPending(now);
        if (m.blocks().size() != TagGeometry.BLOCK_COUNT) {
            return new Result(idle, BridgeIntents.of(new BridgeIntents.FailRequest(m.requestId(),
                    Reason.MALFORMED_RESPONSE, "expected " + TagGeometry.BLOCK_COUNT + " blocks, got " + m.blocks().size())));
        }
        return new Result(idle, BridgeIntents.of(new BridgeIntents.CompleteRead(m.requestId(), m)));
    }

    private Result onWriteResult(BridgeSessionState state, WriteResult m, Instant now) {
        if (!matchesPending(state, m.requestId(), RequestKind.WRITE)) {
            return violation(state, "unmatched WRITE_RESULT for request " + m.requestId());
        }
        BridgeSessionState idle = state.withoutPending(now);
        if (!m.success()) {
            return new Result(idle, BridgeIntents.of(new BridgeIntents.FailRequest(m.requestId(),
                    Reason.WRITE_FAILED, m.error().orElse("write failed"))));
        }
        return new Result(idle, BridgeIntents.of(new BridgeIntents.CompleteWrite(m.requestId(), m.blocksWritten())));
    }

    private Result onAgentError(BridgeSessionState state, AgentError m, Instant now) {
        if (state.pending().isEmpty()) {
            return violation(state, "agent error with no request pending: " + m.message());
        }
        String pendingId = state.pending().get().requestId();
        // An error without an id applies to whatever is pending.
        if (m.requestId().isPresent() && !m.requestId().get().equals(pendingId)) {
            return violation(state, "agent error for unknown request " + m.requestId().get() + ": " + m.message());
        }
        return new Result(state.withoutPending(now),
                BridgeIntents.of(new BridgeIntents.FailRequest(pendingId, Reason.AGENT_ERROR, m.message())));
    }

    private Result onMalformedMessage(BridgeSessionState state, BridgeMessageEvent.MalformedMessageReceived e) {
        if (e.requestId().isEmpty() || !state.isPending(e.requestId().get())) {
            return violation(state, e.detail());
        }
        return new Result(state.withoutPending(e.timestamp()),
                BridgeIntents.of(new BridgeIntents.FailRequest(e.requestId().get(), Reason.MALFORMED_RESPONSE, e.detail())));
    }

    private static boolean matchesPending(BridgeSessionState state, String requestId, RequestKind kind) {
        return state.isPending(requestId) && state.pending().get().kind() == kind;
    }

    private static Result violation(BridgeSessionState state, String detail) {
        return new Result(state, BridgeIntents.of(new BridgeIntents.ReportViolation(detail)));
    }
}
