package com.questrail.spooltag.codec.impl;

import com.questrail.spooltag.codec.FieldOutOfRangeException;
import com.questrail.spooltag.crypto.KeyDerivation;
import com.questrail.spooltag.crypto.KeyDerivationConfig;
import com.questrail.spooltag.model.FilamentColor;
import com.questrail.spooltag.model.FilamentRecord;
import com.questrail.spooltag.tag.TagImage;
import com.questrail.spooltag.tag.TagUid;
import com.questrail.spooltag.tag.TestImages;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultFilamentTagEncoderTest
 * -----------------------------------------------------------------------------
 * Encoding into a template and decoding back, plus strict range handling.
 */
class DefaultFilamentTagEncoderTest {

    private static final TagUid UID = TagUid.fromHex("7AD43F1C");

    private final DefaultFilamentTagEncoder encoder = new DefaultFilamentTagEncoder();
    private final DefaultFilamentTagDecoder decoder = new DefaultFilamentTagDecoder();

    private static FilamentRecord.Builder petg() {
        return FilamentRecord.builder()
                .withUid(UID)
                .withMaterialVariantId("G01-K0")
                .withMaterialId("GFG01")
                .withFilamentType("PETG")
                .withDetailedFilamentType("PETG HF")
                .withColor(new FilamentColor(0x12, 0x34, 0x56, 0xFF))
                .withSpoolWeightG(1000)
                .withFilamentDiameterMm(1.75f)
                .withDryingTempC(65)
                .withDryingTimeH(8)
                .withBedTempType(1)
                .withBedTempC(70)
                .withMaxHotendTempC(260)
                .withMinHotendTempC(230)
                .withNozzleDiameter(0.4f)
                .withTrayUid("00112233445566AA")
                .withSpoolWidthMm(66.25)
                .withProductionDateTime("2024_01_02_03_04")
                .withShortProductionDateTime("240102")
                .withFilamentLengthM(330)
                .withColorFormat(2)
                .withColorCount(2)
                .withSecondaryColor(new FilamentColor(0xAB, 0xCD, 0xEF, 0x80));
    }

    @Test
    void encodedRecordDecodesBackIntoTemplate() {
        FilamentRecord original = petg().build();
        TagImage template = TestImages.template(UID, new KeyDerivation(KeyDerivationConfig.defaults()).derive(UID));

        TagImage written = template.withPayloadFrom(encoder.encode(original));
        FilamentRecord decoded = decoder.decode(written);

        assertEquals(original, decoded);
        assertEquals(template.block(0), written.block(0));
        assertEquals(template.block(63), written.block(63));
    }

    @Test
    void encoderNeverTouchesStructuralOrSignatureBlocks() {
        TagImage image = encoder.encode(petg().build());

        assertTrue(image.block(0).isZero());
        for (int s = 0; s < 16; s++) {
            assertTrue(image.block(s * 4 + 3).isZero(), "trailer of sector " + s);
        }
        for (int b = 40; b < 64; b++) {
            assertTrue(image.block(b).isZero(), "block " + b);
        }
    }

    @Test
    void singleColorSpoolLeavesSecondarySlotEmpty() {
        FilamentRecord r = petg().withColorFormat(1).withColorCount(1).withSecondaryColor(null).build();
        byte[] multicolor = encoder.encode(r).block(16).toBytes();
        for (int i = 4; i < 8; i++) {
            assertEquals(0, multicolor[i]);
        }
    }

    @Test
    void uint16OverflowFails() {
        FieldOutOfRangeException e = assertThrows(FieldOutOfRangeException.class,
                () -> encoder.encode(petg().withSpoolWeightG(65536).build()));
        assertEquals("spoolWeightG", e.field());

        assertThrows(FieldOutOfRangeException.class,
                () -> encoder.encode(petg().withBedTempC(-1).build()));
    }

    @Test
    void uint16MaximumIsAccepted() {
        assertEquals(65535, decoder.decode(encoder.encode(petg().withFilamentLengthM(65535).build())).filamentLengthM());
    }

    @Test
    void overlongStringsFail() {
        assertThrows(FieldOutOfRangeException.class,
                () -> encoder.encode(petg().withMaterialId("GFG01-LONG").build()));
        assertThrows(FieldOutOfRangeException.class,
                () -> encoder.encode(petg().withTrayUid("00112233445566AAB").build()));
    }

    @Test
    void nonAsciiStringsFail() {
        FieldOutOfRangeException e = assertThrows(FieldOutOfRangeException.class,
                () -> encoder.encode(petg().withFilamentType("PLAé").build()));
        assertEquals("filamentType", e.field());
    }

    @Test
    void nonFiniteNumbersFail() {
        assertThrows(FieldOutOfRangeException.class,
                () -> encoder.encode(petg().withSpoolWidthMm(Double.NaN).build()));
        assertThrows(FieldOutOfRangeException.class,
                () -> encoder.encode(petg().withFilamentDiameterMm(Float.POSITIVE_INFINITY).build()));
        assertThrows(FieldOutOfRangeException.class,
                () -> encoder.encode(petg().withSpoolWidthMm(655.36).build()));
    }
}
