package com.questrail.spooltag.bridge.model;

import java.util.Objects;

/**
 * Sent by the agent once its connection is established.
 */
public record AgentStatus(boolean connected, String device) implements AgentMessage
{
    public AgentStatus {
        Objects.requireNonNull(device, "device");
    }

    @Override
    public BridgeAction action() {
        return BridgeAction.STATUS;
    }
}
