package com.questrail.spooltag.bridge.internal.decode;

import com.questrail.spooltag.bridge.model.AgentError;
import com.questrail.spooltag.bridge.model.AgentStatus;
import com.questrail.spooltag.bridge.model.BridgeMessage;
import com.questrail.spooltag.bridge.model.ReadTagRequest;
import com.questrail.spooltag.bridge.model.TagData;
import com.questrail.spooltag.bridge.model.TagDetected;
import com.questrail.spooltag.bridge.model.WriteResult;
import com.questrail.spooltag.bridge.model.WriteTagRequest;
import com.questrail.spooltag.tag.SectorReadability;
import com.questrail.spooltag.tag.TagUid;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * BridgeMessageDecoderTest
 * -----------------------------------------------------------------------------
 * Envelope parsing and shape validation.
 */
class BridgeMessageDecoderTest {

    private static final String ZERO_BLOCK = "AAAAAAAAAAAAAAAAAAAAAA==";

    private final BridgeMessageDecoder decoder = new BridgeMessageDecoder();

    private static String blocks(int count) {
        return "[" + String.join(",", Collections.nCopies(count, "\"" + ZERO_BLOCK + "\"")) + "]";
    }

    private static String keys(String key) {
        return "[" + String.join(",", Collections.nCopies(16, "\"" + key + "\"")) + "]";
    }

    @Test
    void decodesStatus() {
        BridgeMessage m = decoder.decode("{\"action\":\"STATUS\",\"connected\":true,\"device\":\"Pixel 8\"}");
        assertEquals(new AgentStatus(true, "Pixel 8"), m);
    }

    @Test
    void decodesTagDetected() {
        BridgeMessage m = decoder.decode("{\"action\":\"TAG_DETECTED\",\"uid\":\"deadbeef\"}");
        assertEquals(new TagDetected(TagUid.fromHex("DEADBEEF")), m);
    }

    @Test
    void decodesTagDataWithoutCountingBlocks() {
        TagData m = (TagData) decoder.decode(
                "{\"action\":\"TAG_DATA\",\"uid\":\"DEADBEEF\",\"request_id\":\"7\",\"blocks\":" + blocks(3) + "}");

        assertEquals("7", m.requestId());
        assertEquals(3, m.blocks().size());
        assertTrue(m.readability().isComplete());
    }

    @Test
    void decodesUnreadableSectors() {
        TagData m = (TagData) decoder.decode("{\"action\":\"TAG_DATA\",\"uid\":\"DEADBEEF\",\"request_id\":\"7\","
                + "\"blocks\":" + blocks(64) + ",\"unreadable_sectors\":[2,5]}");

        assertEquals(SectorReadability.withUnreadable(List.of(2, 5)), m.readability());
    }

    @Test
    void decodesWriteResult() {
        BridgeMessage m = decoder.decode(
                "{\"action\":\"WRITE_RESULT\",\"success\":false,\"blocks_written\":0,\"error\":\"auth\",\"request_id\":\"9\"}");
        assertEquals(new WriteResult(false, 0, Optional.of("auth"), "9"), m);
    }

    @Test
    void decodesErrorWithAndWithoutId() {
        assertEquals(new AgentError("busy", Optional.of("3")),
                decoder.decode("{\"action\":\"ERROR\",\"message\":\"busy\",\"request_id\":\"3\"}"));
        assertEquals(new AgentError("agent error", Optional.empty()),
                decoder.decode("{\"action\":\"ERROR\"}"));
    }

    @Test
    void decodesRequests() {
        ReadTagRequest read = (ReadTagRequest) decoder.decode("{\"action\":\"READ_TAG\",\"request_id\":\"1\"}");
        assertTrue(read.keys().isEmpty());

        WriteTagRequest write = (WriteTagRequest) decoder.decode("{\"action\":\"WRITE_TAG\",\"request_id\":\"2\","
                + "\"keys\":" + keys("FFFFFFFFFFFF") + ",\"blocks\":" + blocks(64) + ",\"uid\":\"01020304\"}");
        assertEquals(TagUid.fromHex("01020304"), write.targetUid().orElseThrow());
        assertEquals("FFFFFFFFFFFF", write.keys().get(0).toHex());
    }

    @Test
    void unknownFieldsAreIgnored() {
        assertInstanceOf(TagDetected.class,
                decoder.decode("{\"action\":\"TAG_DETECTED\",\"uid\":\"DEADBEEF\",\"rssi\":-40}"));
    }

    @Test
    void invalidJsonIsAViolation() {
        assertThrows(ProtocolViolationException.class, () -> decoder.decode("{nope"));
        assertThrows(ProtocolViolationException.class, () -> decoder.decode("[1,2]"));
    }

    @Test
    void unknownActionIsAViolation() {
        ProtocolViolationException e = assertThrows(ProtocolViolationException.class,
                () -> decoder.decode("{\"action\":\"REBOOT\",\"request_id\":\"4\"}"));
        assertEquals(Optional.of("4"), e.requestId());
    }

    @Test
    void badBlockKeepsRequestId() {
        ProtocolViolationException e = assertThrows(ProtocolViolationException.class,
                () -> decoder.decode("{\"action\":\"TAG_DATA\",\"uid\":\"DEADBEEF\",\"request_id\":\"5\",\"blocks\":[\"AAAA\"]}"));
        assertEquals(Optional.of("5"), e.requestId());
    }

    @Test
    void badShapesAreViolations() {
        assertThrows(ProtocolViolationException.class,
                () -> decoder.decode("{\"action\":\"TAG_DETECTED\",\"uid\":\"DEAD\"}"));
        assertThrows(ProtocolViolationException.class,
                () -> decoder.decode("{\"action\":\"WRITE_TAG\",\"request_id\":\"2\",\"keys\":" + keys("FFFF")
                        + ",\"blocks\":" + blocks(64) + "}"));
        assertThrows(ProtocolViolationException.class,
                () -> decoder.decode("{\"action\":\"WRITE_RESULT\",\"success\":true,\"request_id\":\"1\"}"));
        assertThrows(ProtocolViolationException.class,
                () -> decoder.decode("{\"action\":\"TAG_DATA\",\"uid\":\"DEADBEEF\",\"request_id\":\"7\","
                        + "\"blocks\":" + blocks(64) + ",\"unreadable_sectors\":[16]}"));
    }
}
