package com.questrail.spooltag.bridge;

import java.util.Objects;

/**
 * Session-level failure of a bridge request, delivered through the request's
 * future. The core never retries; retry is the caller's policy.
 */
public final class BridgeRequestException extends RuntimeException
{
    public enum Reason {
        /** The transport is not open, or dropped while the request was pending. */
        NO_BRIDGE_CONNECTED,

        /** Another request is awaiting a tag. */
        REQUEST_IN_PROGRESS,

        /** No matching response before the deadline. */
        TIMEOUT,

        /** The agent reported an error for the pending request. */
        AGENT_ERROR,

        /** The agent reported that the write could not be carried out. */
        WRITE_FAILED,

        /** The request asks for something the configured hardware cannot do. */
        UNSUPPORTED_OPERATION,

        /** A correlated response had the wrong shape. */
        MALFORMED_RESPONSE
    }

    private final Reason reason;

    public BridgeRequestException(Reason reason, String message) {
        super(reason + ": " + message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public Reason reason() {
        return reason;
    }
}
