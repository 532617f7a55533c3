package com.questrail.spooltag.bridge.model;

import com.questrail.spooltag.tag.TagUid;

import java.util.Objects;

/**
 * A tag touched the agent's reader. Sent whether or not a request is pending.
 */
public record TagDetected(TagUid uid) implements AgentMessage
{
    public TagDetected {
        Objects.requireNonNull(uid, "uid");
    }

    @Override
    public BridgeAction action() {
        return BridgeAction.TAG_DETECTED;
    }
}
