package com.questrail.spooltag.tag;

import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TagValuesTest {

    @Test
    void uidParsesHexIgnoringCase() {
        assertEquals(TagUid.fromHex("DEADBEEF"), TagUid.fromHex("deadbeef"));
        assertEquals("DEADBEEF", TagUid.fromHex("deadbeef").toHex());
    }

    @Test
    void uidRejectsWrongLength() {
        assertThrows(IllegalArgumentException.class, () -> TagUid.fromHex("DEADBE"));
        assertThrows(IllegalArgumentException.class, () -> TagUid.of(new byte[7]));
    }

    @Test
    void uidBytesAreCopied() {
        byte[] raw = {1, 2, 3, 4};
        TagUid uid = TagUid.of(raw);
        raw[0] = 9;
        assertEquals(1, uid.toBytes()[0]);
    }

    @Test
    void sectorKeyIsSixBytes() {
        assertEquals("FFFFFFFFFFFF", SectorKey.fromHex("ffffffffffff").toHex());
        assertThrows(IllegalArgumentException.class, () -> SectorKey.fromHex("FFFF"));
    }

    @Test
    void keySetNeedsSixteenKeys() {
        assertThrows(IllegalArgumentException.class,
                () -> KeySet.of(Collections.nCopies(15, SectorKey.fromHex("FFFFFFFFFFFF"))));
        KeySet ks = KeySet.fromHex(Collections.nCopies(16, "A0A1A2A3A4A5"));
        assertEquals(SectorKey.fromHex("A0A1A2A3A4A5"), ks.get(15));
    }

    @Test
    void readabilityTracksUnreadableSectors() {
        SectorReadability r = SectorReadability.withUnreadable(List.of(2, 5));

        assertFalse(r.isComplete());
        assertFalse(r.isReadable(2));
        assertTrue(r.isReadable(3));
        assertEquals(List.of(2, 5), r.unreadableSectors());
        assertEquals(r, SectorReadability.fromMask(r.mask()));
        assertTrue(SectorReadability.allReadable().isComplete());
    }

    @Test
    void readabilityMaskIsSixteenBits() {
        assertThrows(IllegalArgumentException.class, () -> SectorReadability.fromMask(0x10000));
    }
}
