package com.questrail.spooltag.bridge.model;

import com.questrail.spooltag.tag.KeySet;

import java.util.Objects;
import java.util.Optional;

/**
 * Request to read the next touched tag. Without keys the agent derives them
 * locally from the tag's uid.
 */
public record ReadTagRequest(String requestId, Optional<KeySet> keys) implements BridgeRequest
{
    public ReadTagRequest {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(keys, "keys");
    }

    @Override
    public BridgeAction action() {
        return BridgeAction.READ_TAG;
    }
}
