package com.questrail.spooltag.bridge.internal.encode;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.spooltag.bridge.internal.decode.BridgeMessageDecoder;
import com.questrail.spooltag.bridge.model.AgentError;
import com.questrail.spooltag.bridge.model.ReadTagRequest;
import com.questrail.spooltag.bridge.model.TagData;
import com.questrail.spooltag.bridge.model.WriteTagRequest;
import com.questrail.spooltag.tag.KeySet;
import com.questrail.spooltag.tag.SectorKey;
import com.questrail.spooltag.tag.SectorReadability;
import com.questrail.spooltag.tag.TagImage;
import com.questrail.spooltag.tag.TagUid;
import com.questrail.spooltag.tag.TestImages;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BridgeMessageEncoderTest {

    private static final KeySet KEYS = KeySet.of(Collections.nCopies(16, SectorKey.fromHex("0A0B0C0D0E0F")));

    private final BridgeMessageEncoder encoder = new BridgeMessageEncoder();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void readRequestOmitsAbsentKeys() throws Exception {
        JsonNode n = mapper.readTree(encoder.encode(new ReadTagRequest("12", Optional.empty())));

        assertEquals("READ_TAG", n.get("action").asText());
        assertEquals("12", n.get("request_id").asText());
        assertFalse(n.has("keys"));
    }

    @Test
    void writeRequestCarriesKeysBlocksAndUid() throws Exception {
        TagImage image = TagImage.blank().withBlock(1, TestImages.filled(0xFF));
        JsonNode n = mapper.readTree(encoder.encode(
                new WriteTagRequest("3", KEYS, image, Optional.of(TagUid.fromHex("CAFEBABE")))));

        assertEquals(16, n.get("keys").size());
        assertEquals("0A0B0C0D0E0F", n.get("keys").get(15).asText());
        assertEquals(64, n.get("blocks").size());
        assertEquals("/////////////////////w==", n.get("blocks").get(1).asText());
        assertEquals("CAFEBABE", n.get("uid").asText());
    }

    @Test
    void tagDataListsUnreadableSectorsOnlyWhenIncomplete() throws Exception {
        TagData complete = new TagData(TagUid.fromHex("DEADBEEF"), TagImage.blank().blocks(), "1",
                SectorReadability.allReadable());
        assertFalse(mapper.readTree(encoder.encode(complete)).has("unreadable_sectors"));

        TagData partial = new TagData(TagUid.fromHex("DEADBEEF"), TagImage.blank().blocks(), "1",
                SectorReadability.withUnreadable(List.of(4)));
        assertEquals(4, mapper.readTree(encoder.encode(partial)).get("unreadable_sectors").get(0).asInt());
    }

    @Test
    void encoderOutputIsAcceptedByDecoder() {
        BridgeMessageDecoder decoder = new BridgeMessageDecoder();
        WriteTagRequest write = new WriteTagRequest("8", KEYS, TagImage.blank(), Optional.empty());
        AgentError error = new AgentError("reader busy", Optional.empty());

        assertEquals(write, decoder.decode(encoder.encode(write)));
        assertEquals(error, decoder.decode(encoder.encode(error)));
    }
}
