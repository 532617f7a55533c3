package com.questrail.spooltag.bridge.model;

import com.questrail.spooltag.tag.Block;
import com.questrail.spooltag.tag.SectorReadability;
import com.questrail.spooltag.tag.TagUid;

import java.util.List;
import java.util.Objects;

/**
 * Read response.
 *
 * <p>{@code blocks} is kept as received so the session can reject a wrongly
 * sized image as malformed instead of failing in the decoder. Unreadable
 * sectors arrive zero-filled and are flagged in {@code readability}.</p>
 */
public record TagData(TagUid uid,
                      List<Block> blocks,
                      String requestId,
                      SectorReadability readability) implements AgentMessage
{
    public TagData {
        Objects.requireNonNull(uid, "uid");
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(readability, "readability");
        blocks = List.copyOf(Objects.requireNonNull(blocks, "blocks"));
    }

    @Override
    public BridgeAction action() {
        return BridgeAction.TAG_DATA;
    }
}
