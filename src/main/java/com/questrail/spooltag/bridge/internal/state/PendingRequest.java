package com.questrail.spooltag.bridge.internal.state;

import com.questrail.spooltag.bridge.model.BridgeRequest;
import com.questrail.spooltag.bridge.model.ReadTagRequest;
import com.questrail.spooltag.bridge.model.WriteTagRequest;
import com.questrail.spooltag.tag.KeySet;
import com.questrail.spooltag.tag.TagImage;
import com.questrail.spooltag.tag.TagUid;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * PendingRequest
 * -----------------------------------------------------------------------------
 * The single in-flight tag operation of a session.
 *
 * <p>{@code deadlineNanos} is a monotonic tick computed when the request was
 * submitted; the reducer never reads a clock.</p>
 *
 * @param kind          READ or WRITE
 * @param requestId     correlation id echoed by the agent
 * @param keys          sector keys; absent for reads that let the agent derive
 * @param payload       image to write (WRITE only)
 * @param targetUid     identifier rewrite target (WRITE only)
 * @param timeout       caller-supplied timeout
 * @param deadlineNanos monotonic deadline
 */
public record PendingRequest(RequestKind kind,
                             String requestId,
                             Optional<KeySet> keys,
                             Optional<TagImage> payload,
                             Optional<TagUid> targetUid,
                             Duration timeout,
                             long deadlineNanos)
{
    public PendingRequest {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(keys, "keys");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(targetUid, "targetUid");
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be non-negative");
        }
        if (kind == RequestKind.WRITE && (keys.isEmpty() || payload.isEmpty())) {
            throw new IllegalArgumentException("WRITE requires keys and payload");
        }
        if (kind == RequestKind.READ && (payload.isPresent() || targetUid.isPresent())) {
            throw new IllegalArgumentException("READ carries no payload or target uid");
        }
    }

    public static PendingRequest read(String requestId, Optional<KeySet> keys, Duration timeout, long deadlineNanos) {
        return new PendingRequest(RequestKind.READ, requestId, keys, Optional.empty(), Optional.empty(), timeout, deadlineNanos);
    }

    public static PendingRequest write(String requestId, KeySet keys, TagImage payload, Optional<TagUid> targetUid,
                                       Duration timeout, long deadlineNanos) {
        return new PendingRequest(RequestKind.WRITE, requestId, Optional.of(keys), Optional.of(payload), targetUid,
                timeout, deadlineNanos);
    }

    /** The wire request announcing this operation to the agent. */
    public BridgeRequest toMessage() {
        return switch (kind) {
            case READ -> new ReadTagRequest(requestId, keys);
            case WRITE -> new WriteTagRequest(requestId, keys.get(), payload.get(), targetUid);
        };
    }

    @Override
    public String toString() {
        return "PendingRequest[" + kind + " id=" + requestId + ", timeout=" + timeout + "]";
    }
}
