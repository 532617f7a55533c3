package com.questrail.spooltag.bridge.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Write response. A partial write is still {@code success == true} with a
 * short {@code blocksWritten}.
 */
public record WriteResult(boolean success,
                          int blocksWritten,
                          Optional<String> error,
                          String requestId) implements AgentMessage
{
    public WriteResult {
        Objects.requireNonNull(error, "error");
        Objects.requireNonNull(requestId, "requestId");
        if (blocksWritten < 0) {
            throw new IllegalArgumentException("blocksWritten must be >= 0");
        }
    }

    @Override
    public BridgeAction action() {
        return BridgeAction.WRITE_RESULT;
    }
}
