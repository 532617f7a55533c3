package com.questrail.spooltag.bridge.internal.state;

import com.questrail.spooltag.bridge.BridgeRequestException;
import com.questrail.spooltag.bridge.model.BridgeRequest;
import com.questrail.spooltag.bridge.model.TagData;
import com.questrail.spooltag.tag.TagUid;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * BridgeIntents
 * -----------------------------------------------------------------------------
 * Immutable, ordered list of effects emitted by the {@link BridgeStateReducer}.
 *
 * <h2>Role in the architecture</h2>
 * The reducer decides <b>what should happen next</b>; the executor decides
 * <b>how</b>. No intent performs I/O on its own.
 *
 * <p>Order is significant: executors apply intents in list order.</p>
 */
public final class BridgeIntents
{
    /**
     * Enumerates the kinds of effects the session may need.
     */
    public enum Kind {
        /** Send a request to the agent and arm its deadline. */
        SEND_REQUEST,

        /** Resolve the pending read with the received image. */
        COMPLETE_READ,

        /** Resolve the pending write with the written block count. */
        COMPLETE_WRITE,

        /** Fail a request (pending or rejected) with a reason. */
        FAIL_REQUEST,

        /** Tell the initiator a tag touched the reader. */
        NOTIFY_TAG_DETECTED,

        /** Report inbound traffic that had no valid place in the protocol. */
        REPORT_VIOLATION
    }

    /** A single effect. */
    public sealed interface Intent
            permits SendRequest, CompleteRead, CompleteWrite, FailRequest, NotifyTagDetected, ReportViolation
    {
        Kind kind();
    }

    public record SendRequest(BridgeRequest request, long deadlineNanos) implements Intent {
        public SendRequest {
            Objects.requireNonNull(request, "request");
        }

        @Override
        public Kind kind() {
            return Kind.SEND_REQUEST;
        }
    }

    public record CompleteRead(String requestId, TagData data) implements Intent {
        public CompleteRead {
            Objects.requireNonNull(requestId, "requestId");
            Objects.requireNonNull(data, "data");
        }

        @Override
        public Kind kind() {
            return Kind.COMPLETE_READ;
        }
    }

    public record CompleteWrite(String requestId, int blocksWritten) implements Intent {
        public CompleteWrite {
            Objects.requireNonNull(requestId, "requestId");
        }

        @Override
        public Kind kind() {
            return Kind.COMPLETE_WRITE;
        }
    }

    public record FailRequest(String requestId, BridgeRequestException.Reason reason, String detail) implements Intent {
        public FailRequest {
            Objects.requireNonNull(requestId, "requestId");
            Objects.requireNonNull(reason, "reason");
            Objects.requireNonNull(detail, "detail");
        }

        @Override
        public Kind kind() {
            return Kind.FAIL_REQUEST;
        }
    }

    public record NotifyTagDetected(TagUid uid) implements Intent {
        public NotifyTagDetected {
            Objects.requireNonNull(uid, "uid");
        }

        @Override
        public Kind kind() {
            return Kind.NOTIFY_TAG_DETECTED;
        }
    }

    public record ReportViolation(String detail) implements Intent {
        public ReportViolation {
            Objects.requireNonNull(detail, "detail");
        }

        @Override
        public Kind kind() {
            return Kind.REPORT_VIOLATION;
        }
    }

    private static final BridgeIntents NONE = new BridgeIntents(List.of());

    private final List<Intent> intents;

    private BridgeIntents(List<Intent> intents) {
        this.intents = intents;
    }

    public static BridgeIntents none() {
        return NONE;
    }

    public static BridgeIntents of(Intent... intents) {
        return new BridgeIntents(List.of(intents));
    }

    public List<Intent> intents() {
        return intents;
    }

    public boolean isEmpty() {
        return intents.isEmpty();
    }

    public boolean contains(Kind kind) {
        for (Intent i : intents) {
            if (i.kind() == kind) {
                return true;
            }
        }
        return false;
    }

    /** First intent of the given type, if any. */
    public <T extends Intent> Optional<T> first(Class<T> type) {
        for (Intent i : intents) {
            if (type.isInstance(i)) {
                return Optional.of(type.cast(i));
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BridgeIntents other && intents.equals(other.intents);
    }

    @Override
    public int hashCode() {
        return intents.hashCode();
    }

    @Override
    public String toString() {
        return "BridgeIntents" + intents;
    }
}
