package com.questrail.spooltag.tag;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TagImageTest
 * -----------------------------------------------------------------------------
 * Shape validation and the payload/template merge used when writing.
 */
class TagImageTest {

    private static final TagUid UID = TagUid.fromHex("DEADBEEF");
    private static final KeySet KEYS = KeySet.of(Collections.nCopies(16, SectorKey.fromHex("A0A1A2A3A4A5")));

    @Test
    void rejectsWrongBlockCount() {
        List<Block> short63 = new ArrayList<>(Collections.nCopies(63, Block.zero()));
        assertThrows(MalformedImageException.class, () -> TagImage.of(short63));

        List<Block> long65 = new ArrayList<>(Collections.nCopies(65, Block.zero()));
        assertThrows(MalformedImageException.class, () -> TagImage.of(long65));
    }

    @Test
    void rejectsWrongBlockSize() {
        assertThrows(MalformedImageException.class, () -> Block.of(new byte[15]));
        assertThrows(MalformedImageException.class, () -> TagImage.fromBytes(new byte[1023]));
    }

    @Test
    void uidComesFromBlockZero() {
        TagImage image = TestImages.template(UID, KEYS);
        assertEquals(UID, image.uid());
        assertEquals("DEADBEEF", image.uid().toHex());
    }

    @Test
    void bytesRoundTripThroughRawDump() {
        TagImage image = TestImages.template(UID, KEYS).withBlock(5, TestImages.filled(0x5A));
        assertEquals(image, TagImage.fromBytes(image.toBytes()));
    }

    @Test
    void payloadOnlyClearsStructuralBlocks() {
        TagImage image = TestImages.template(UID, KEYS).withBlock(1, TestImages.filled(0x11));

        TagImage payload = image.payloadOnly();

        assertTrue(payload.block(0).isZero());
        assertTrue(payload.block(3).isZero());
        assertTrue(payload.block(63).isZero());
        assertEquals(TestImages.filled(0x11), payload.block(1));
    }

    @Test
    void withPayloadFromKeepsTemplateStructure() {
        TagImage template = TestImages.template(UID, KEYS);
        List<Block> all = new ArrayList<>(Collections.nCopies(64, TestImages.filled(0xEE)));
        TagImage payload = TagImage.of(all);

        TagImage merged = template.withPayloadFrom(payload);

        assertEquals(template.block(0), merged.block(0));
        assertEquals(template.block(7), merged.block(7));
        assertEquals(TestImages.filled(0xEE), merged.block(1));
        assertEquals(TestImages.filled(0xEE), merged.block(62));
    }

    @Test
    void sectorViewEndsWithTrailer() {
        TagImage image = TestImages.template(UID, KEYS);
        List<Block> sector2 = image.sector(2);
        assertEquals(4, sector2.size());
        assertEquals(SectorKey.fromHex("A0A1A2A3A4A5"), TestImages.trailerKeyA(sector2.get(3)));
    }

    @Test
    void imagesAreImmutable() {
        TagImage image = TagImage.blank();
        assertThrows(UnsupportedOperationException.class, () -> image.blocks().set(1, TestImages.filled(1)));
        TagImage changed = image.withBlock(1, TestImages.filled(1));
        assertTrue(image.block(1).isZero());
        assertFalse(changed.block(1).isZero());
    }
}
