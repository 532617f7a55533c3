package com.questrail.spooltag.bridge.internal.encode;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.spooltag.bridge.internal.EnvelopeFields;
import com.questrail.spooltag.bridge.model.AgentError;
import com.questrail.spooltag.bridge.model.AgentStatus;
import com.questrail.spooltag.bridge.model.BridgeMessage;
import com.questrail.spooltag.bridge.model.ReadTagRequest;
import com.questrail.spooltag.bridge.model.TagData;
import com.questrail.spooltag.bridge.model.TagDetected;
import com.questrail.spooltag.bridge.model.WriteResult;
import com.questrail.spooltag.bridge.model.WriteTagRequest;
import com.questrail.spooltag.tag.Block;
import com.questrail.spooltag.tag.KeySet;

import java.util.Base64;
import java.util.List;
import java.util.Objects;

/**
 * BridgeMessageEncoder
 * -----------------------------------------------------------------------------
 * Translates a semantic {@link BridgeMessage} into its JSON text envelope.
 *
 * <p>Blocks are base64 of 16 raw bytes, keys 12 hex characters and uids 8 hex
 * characters. Optional fields are omitted when absent.</p>
 */
public final class BridgeMessageEncoder
{
    private final ObjectMapper mapper;

    public BridgeMessageEncoder() {
        this(new ObjectMapper());
    }

    public BridgeMessageEncoder(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public String encode(BridgeMessage message)
    {
        Objects.requireNonNull(message, "message");

        ObjectNode root = mapper.createObjectNode();
        root.put(EnvelopeFields.ACTION, message.action().wireName());

        if (message instanceof ReadTagRequest m) {
            root.put(EnvelopeFields.REQUEST_ID, m.requestId());
            m.keys().ifPresent(k -> root.set(EnvelopeFields.KEYS, keys(k)));
        } else if (message instanceof WriteTagRequest m) {
            root.put(EnvelopeFields.REQUEST_ID, m.requestId());
            root.set(EnvelopeFields.KEYS, keys(m.keys()));
            root.set(EnvelopeFields.BLOCKS, blocks(m.blocks().blocks()));
            m.targetUid().ifPresent(u -> root.put(EnvelopeFields.UID, u.toHex()));
        } else if (message instanceof AgentStatus m) {
            root.put(EnvelopeFields.CONNECTED, m.connected());
            root.put(EnvelopeFields.DEVICE, m.device());
        } else if (message instanceof TagDetected m) {
            root.put(EnvelopeFields.UID, m.uid().toHex());
        } else if (message instanceof TagData m) {
            root.put(EnvelopeFields.UID, m.uid().toHex());
            root.set(EnvelopeFields.BLOCKS, blocks(m.blocks()));
            root.put(EnvelopeFields.REQUEST_ID, m.requestId());
            if (!m.readability().isComplete()) {
                ArrayNode sectors = root.putArray(EnvelopeFields.UNREADABLE_SECTORS);
                m.readability().unreadableSectors().forEach(sectors::add);
            }
        } else if (message instanceof WriteResult m) {
            root.put(EnvelopeFields.SUCCESS, m.success());
            root.put(EnvelopeFields.BLOCKS_WRITTEN, m.blocksWritten());
            m.error().ifPresent(e -> root.put(EnvelopeFields.ERROR, e));
            root.put(EnvelopeFields.REQUEST_ID, m.requestId());
        } else if (message instanceof AgentError m) {
            root.put(EnvelopeFields.MESSAGE, m.message());
            m.requestId().ifPresent(id -> root.put(EnvelopeFields.REQUEST_ID, id));
        }

        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            // A tree of value nodes always serializes.
            throw new IllegalStateException("failed to serialize " + message.action(), e);
        }
    }

    private ArrayNode keys(KeySet keys) {
        ArrayNode arr = mapper.createArrayNode();
        keys.toHex().forEach(arr::add);
        return arr;
    }

    private ArrayNode blocks(List<Block> blocks) {
        ArrayNode arr = mapper.createArrayNode();
        for (Block b : blocks) {
            arr.add(Base64.getEncoder().encodeToString(b.toBytes()));
        }
        return arr;
    }
}
