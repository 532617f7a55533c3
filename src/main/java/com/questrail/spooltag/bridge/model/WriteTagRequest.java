package com.questrail.spooltag.bridge.model;

import com.questrail.spooltag.tag.KeySet;
import com.questrail.spooltag.tag.TagImage;
import com.questrail.spooltag.tag.TagUid;

import java.util.Objects;
import java.util.Optional;

/**
 * Request to write {@code blocks} to the next touched tag using {@code keys}.
 *
 * <p>The agent never writes block 0 or sector trailers, whatever the image
 * holds there. {@code targetUid} asks for identifier rewriting and is honored
 * only by hardware that supports it.</p>
 */
public record WriteTagRequest(String requestId,
                              KeySet keys,
                              TagImage blocks,
                              Optional<TagUid> targetUid) implements BridgeRequest
{
    public WriteTagRequest {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(keys, "keys");
        Objects.requireNonNull(blocks, "blocks");
        Objects.requireNonNull(targetUid, "targetUid");
    }

    @Override
    public BridgeAction action() {
        return BridgeAction.WRITE_TAG;
    }
}
