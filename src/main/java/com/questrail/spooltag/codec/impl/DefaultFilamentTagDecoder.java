package com.questrail.spooltag.codec.impl;

import com.questrail.spooltag.codec.FilamentTagDecoder;
import com.questrail.spooltag.model.FilamentColor;
import com.questrail.spooltag.model.FilamentRecord;
import com.questrail.spooltag.tag.TagGeometry;
import com.questrail.spooltag.tag.TagImage;

import java.util.Objects;

import static com.questrail.spooltag.codec.impl.TagLayout.*;

/**
 * Default {@link FilamentTagDecoder}.
 *
 * <p>Stateless and thread-safe. Field extraction is purely positional; only
 * the secondary color depends on a previously decoded field (color format).</p>
 */
public final class DefaultFilamentTagDecoder implements FilamentTagDecoder
{
    @Override
    public FilamentRecord decode(TagImage image)
    {
        Objects.requireNonNull(image, "image");

        byte[] material = image.block(MATERIAL_BLOCK).toBytes();
        byte[] physical = image.block(PHYSICAL_BLOCK).toBytes();
        byte[] temps = image.block(TEMPERATURE_BLOCK).toBytes();
        byte[] multicolor = image.block(MULTICOLOR_BLOCK).toBytes();

        int colorFormat = TagBytes.readUint16(multicolor, COLOR_FORMAT_OFFSET);

        FilamentRecord.Builder b = FilamentRecord.builder()
                .withUid(image.uid())
                .withMaterialVariantId(TagBytes.readString(material, MATERIAL_VARIANT_OFFSET, MATERIAL_FIELD_WIDTH))
                .withMaterialId(TagBytes.readString(material, MATERIAL_ID_OFFSET, MATERIAL_FIELD_WIDTH))
                .withFilamentType(fullBlockString(image, FILAMENT_TYPE_BLOCK))
                .withDetailedFilamentType(fullBlockString(image, DETAILED_TYPE_BLOCK))
                .withColor(new FilamentColor(
                        physical[COLOR_OFFSET] & 0xFF,
                        physical[COLOR_OFFSET + 1] & 0xFF,
                        physical[COLOR_OFFSET + 2] & 0xFF,
                        physical[COLOR_OFFSET + 3] & 0xFF))
                .withSpoolWeightG(TagBytes.readUint16(physical, SPOOL_WEIGHT_OFFSET))
                .withFilamentDiameterMm(TagBytes.readFloat32(physical, DIAMETER_OFFSET))
                .withDryingTempC(TagBytes.readUint16(temps, DRYING_TEMP_OFFSET))
                .withDryingTimeH(TagBytes.readUint16(temps, DRYING_TIME_OFFSET))
                .withBedTempType(TagBytes.readUint16(temps, BED_TEMP_TYPE_OFFSET))
                .withBedTempC(TagBytes.readUint16(temps, BED_TEMP_OFFSET))
                .withMaxHotendTempC(TagBytes.readUint16(temps, MAX_HOTEND_OFFSET))
                .withMinHotendTempC(TagBytes.readUint16(temps, MIN_HOTEND_OFFSET))
                .withNozzleDiameter(TagBytes.readFloat32(image.block(NOZZLE_BLOCK).toBytes(), NOZZLE_OFFSET))
                .withTrayUid(fullBlockString(image, TRAY_UID_BLOCK))
                .withSpoolWidthMm(TagBytes.readUint16(image.block(SPOOL_WIDTH_BLOCK).toBytes(), SPOOL_WIDTH_OFFSET) / SPOOL_WIDTH_SCALE)
                .withProductionDateTime(fullBlockString(image, PRODUCTION_DATETIME_BLOCK))
                .withShortProductionDateTime(fullBlockString(image, SHORT_DATETIME_BLOCK))
                .withFilamentLengthM(TagBytes.readUint16(image.block(LENGTH_BLOCK).toBytes(), LENGTH_OFFSET))
                .withColorFormat(colorFormat)
                .withColorCount(TagBytes.readUint16(multicolor, COLOR_COUNT_OFFSET))
                .withRsaSignature(hasSignature(image));

        if (colorFormat == FilamentRecord.COLOR_FORMAT_DUAL) {
            // Stored A, B, G, R.
            int o = SECONDARY_COLOR_OFFSET;
            b.withSecondaryColor(new FilamentColor(
                    multicolor[o + 3] & 0xFF,
                    multicolor[o + 2] & 0xFF,
                    multicolor[o + 1] & 0xFF,
                    multicolor[o] & 0xFF));
        }

        return b.build();
    }

    private static String fullBlockString(TagImage image, int block) {
        return TagBytes.readString(image.block(block).toBytes(), 0, FULL_BLOCK_STRING);
    }

    /**
     * True iff any of the first 256 bytes of the concatenated data blocks of
     * sectors 10..15 is non-zero.
     */
    static boolean hasSignature(TagImage image) {
        int consumed = 0;
        for (int s = SIGNATURE_FIRST_SECTOR; s <= SIGNATURE_LAST_SECTOR; s++) {
            for (int blockNo : TagGeometry.dataBlocksForSector(s)) {
                byte[] data = image.block(blockNo).toBytes();
                for (byte v : data) {
                    if (consumed++ >= SIGNATURE_BYTES) {
                        return false;
                    }
                    if (v != 0) {
                        return true;
                    }
                }
            }
        }
        return false;
    }
}
