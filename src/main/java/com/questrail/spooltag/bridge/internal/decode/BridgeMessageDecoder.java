package com.questrail.spooltag.bridge.internal.decode;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.spooltag.bridge.internal.EnvelopeFields;
import com.questrail.spooltag.bridge.model.AgentError;
import com.questrail.spooltag.bridge.model.AgentStatus;
import com.questrail.spooltag.bridge.model.BridgeAction;
import com.questrail.spooltag.bridge.model.BridgeMessage;
import com.questrail.spooltag.bridge.model.ReadTagRequest;
import com.questrail.spooltag.bridge.model.TagData;
import com.questrail.spooltag.bridge.model.TagDetected;
import com.questrail.spooltag.bridge.model.WriteResult;
import com.questrail.spooltag.bridge.model.WriteTagRequest;
import com.questrail.spooltag.codec.dump.TagDumps;
import com.questrail.spooltag.tag.Block;
import com.questrail.spooltag.tag.KeySet;
import com.questrail.spooltag.tag.MalformedImageException;
import com.questrail.spooltag.tag.SectorReadability;
import com.questrail.spooltag.tag.TagImage;
import com.questrail.spooltag.tag.TagUid;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * BridgeMessageDecoder
 * -----------------------------------------------------------------------------
 * Translates a JSON text envelope into a semantic {@link BridgeMessage}.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Dispatch on {@code action}</li>
 *   <li>Validate field shapes (12 hex char keys, 8 hex char uid, base64 blocks of
 *       16 bytes)</li>
 *   <li>Construct immutable message records</li>
 * </ul>
 *
 * <p>Block <em>count</em> in {@code TAG_DATA} is not checked here; the session
 * owns that decision. Unknown fields are ignored.</p>
 *
 * <p>All failures surface as {@link ProtocolViolationException}.</p>
 */
public final class BridgeMessageDecoder
{
    private final ObjectMapper mapper;

    public BridgeMessageDecoder() {
        this(new ObjectMapper());
    }

    public BridgeMessageDecoder(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public BridgeMessage decode(String text)
    {
        Objects.requireNonNull(text, "text");

        final JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new ProtocolViolationException("envelope is not valid JSON", null, e);
        }
        if (root == null || !root.isObject()) {
            throw new ProtocolViolationException("envelope must be a JSON object");
        }

        String actionName = optionalText(root, EnvelopeFields.ACTION, null);
        BridgeAction action = BridgeAction.fromWireName(actionName)
                .orElseThrow(() -> new ProtocolViolationException("unknown action: " + actionName,
                        optionalText(root, EnvelopeFields.REQUEST_ID, null), null));

        String requestId = optionalText(root, EnvelopeFields.REQUEST_ID, null);
        try {
            return switch (action) {
                case READ_TAG -> decodeReadTag(root);
                case WRITE_TAG -> decodeWriteTag(root);
                case STATUS -> new AgentStatus(
                        optionalBoolean(root, EnvelopeFields.CONNECTED, true),
                        optionalText(root, EnvelopeFields.DEVICE, ""));
                case TAG_DETECTED -> new TagDetected(uid(root));
                case TAG_DATA -> decodeTagData(root);
                case WRITE_RESULT -> new WriteResult(
                        requiredBoolean(root, EnvelopeFields.SUCCESS),
                        requiredInt(root, EnvelopeFields.BLOCKS_WRITTEN),
                        Optional.ofNullable(optionalText(root, EnvelopeFields.ERROR, null)),
                        requiredText(root, EnvelopeFields.REQUEST_ID));
                case ERROR -> new AgentError(
                        optionalText(root, EnvelopeFields.MESSAGE, "agent error"),
                        Optional.ofNullable(requestId));
            };
        } catch (IllegalArgumentException | MalformedImageException e) {
            throw new ProtocolViolationException(action.wireName() + ": " + e.getMessage(), requestId, e);
        }
    }

    private ReadTagRequest decodeReadTag(JsonNode root) {
        JsonNode keys = root.get(EnvelopeFields.KEYS);
        Optional<KeySet> keySet = (keys == null || keys.isNull()) ? Optional.empty() : Optional.of(keySet(keys));
        return new ReadTagRequest(requiredText(root, EnvelopeFields.REQUEST_ID), keySet);
    }

    private WriteTagRequest decodeWriteTag(JsonNode root) {
        JsonNode keys = root.get(EnvelopeFields.KEYS);
        if (keys == null) {
            throw new ProtocolViolationException("WRITE_TAG requires keys", optionalText(root, EnvelopeFields.REQUEST_ID, null), null);
        }
        JsonNode uidNode = root.get(EnvelopeFields.UID);
        Optional<TagUid> target = (uidNode == null || uidNode.isNull() || uidNode.asText().isEmpty())
                ? Optional.empty()
                : Optional.of(TagUid.fromHex(uidNode.asText()));
        return new WriteTagRequest(
                requiredText(root, EnvelopeFields.REQUEST_ID),
                keySet(keys),
                TagImage.of(blocks(root)),
                target);
    }

    private TagData decodeTagData(JsonNode root) {
        JsonNode unreadable = root.get(EnvelopeFields.UNREADABLE_SECTORS);
        SectorReadability readability = SectorReadability.allReadable();
        if (unreadable != null && !unreadable.isNull()) {
            if (!unreadable.isArray()) {
                throw new IllegalArgumentException(EnvelopeFields.UNREADABLE_SECTORS + " must be an array");
            }
            List<Integer> sectors = new ArrayList<>();
            for (JsonNode n : unreadable) {
                if (!n.isInt()) {
                    throw new IllegalArgumentException(EnvelopeFields.UNREADABLE_SECTORS + " must hold integers");
                }
                sectors.add(n.intValue());
            }
            readability = SectorReadability.withUnreadable(sectors);
        }
        return new TagData(uid(root), blocks(root), requiredText(root, EnvelopeFields.REQUEST_ID), readability);
    }

    // ---------------------------------------------------------------------
    // Field helpers
    // ---------------------------------------------------------------------

    private static TagUid uid(JsonNode root) {
        return TagUid.fromHex(requiredText(root, EnvelopeFields.UID));
    }

    private static KeySet keySet(JsonNode keys) {
        if (!keys.isArray()) {
            throw new IllegalArgumentException("keys must be an array");
        }
        List<String> hex = new ArrayList<>(keys.size());
        for (JsonNode k : keys) {
            if (!k.isTextual()) {
                throw new IllegalArgumentException("keys must hold strings");
            }
            hex.add(k.asText());
        }
        return KeySet.fromHex(hex);
    }

    private static List<Block> blocks(JsonNode root) {
        JsonNode blocks = root.get(EnvelopeFields.BLOCKS);
        if (blocks == null || !blocks.isArray()) {
            throw new IllegalArgumentException("blocks must be an array");
        }
        List<Block> out = new ArrayList<>(blocks.size());
        for (JsonNode b : blocks) {
            if (!b.isTextual()) {
                throw new IllegalArgumentException("blocks must hold base64 strings");
            }
            out.add(Block.of(TagDumps.decodeBase64(b.asText())));
        }
        return out;
    }

    private static String requiredText(JsonNode root, String field) {
        JsonNode n = root.get(field);
        if (n == null || !n.isValueNode() || n.isNull()) {
            throw new ProtocolViolationException("missing field: " + field, optionalText(root, EnvelopeFields.REQUEST_ID, null), null);
        }
        return n.asText();
    }

    private static String optionalText(JsonNode root, String field, String fallback) {
        JsonNode n = root.get(field);
        if (n == null || n.isNull() || !n.isValueNode()) {
            return fallback;
        }
        return n.asText();
    }

    private static boolean requiredBoolean(JsonNode root, String field) {
        JsonNode n = root.get(field);
        if (n == null || !n.isBoolean()) {
            throw new ProtocolViolationException("missing boolean field: " + field, optionalText(root, EnvelopeFields.REQUEST_ID, null), null);
        }
        return n.booleanValue();
    }

    private static boolean optionalBoolean(JsonNode root, String field, boolean fallback) {
        JsonNode n = root.get(field);
        return n != null && n.isBoolean() ? n.booleanValue() : fallback;
    }

    private static int requiredInt(JsonNode root, String field) {
        JsonNode n = root.get(field);
        if (n == null || !n.canConvertToInt() || !n.isIntegralNumber()) {
            throw new ProtocolViolationException("missing integer field: " + field, optionalText(root, EnvelopeFields.REQUEST_ID, null), null);
        }
        return n.intValue();
    }
}
