package com.questrail.spooltag.bridge.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Agent-side failure. When {@code requestId} is present it names the request
 * that failed; otherwise the error applies to whatever is pending.
 */
public record AgentError(String message, Optional<String> requestId) implements AgentMessage
{
    public AgentError {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(requestId, "requestId");
    }

    @Override
    public BridgeAction action() {
        return BridgeAction.ERROR;
    }
}
