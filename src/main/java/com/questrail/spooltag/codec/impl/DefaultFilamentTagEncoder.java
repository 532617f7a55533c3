package com.questrail.spooltag.codec.impl;

import com.questrail.spooltag.codec.FieldOutOfRangeException;
import com.questrail.spooltag.codec.FilamentTagEncoder;
import com.questrail.spooltag.model.FilamentColor;
import com.questrail.spooltag.model.FilamentRecord;
import com.questrail.spooltag.tag.Block;
import com.questrail.spooltag.tag.TagGeometry;
import com.questrail.spooltag.tag.TagImage;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static com.questrail.spooltag.codec.impl.TagLayout.*;

/**
 * Default {@link FilamentTagEncoder}.
 *
 * <p>Builds from all-zero blocks. Block 0, the trailers and the signature
 * sectors are never populated. Every range violation fails with
 * {@link FieldOutOfRangeException}; nothing saturates or wraps.</p>
 */
public final class DefaultFilamentTagEncoder implements FilamentTagEncoder
{
    @Override
    public TagImage encode(FilamentRecord r)
    {
        Objects.requireNonNull(r, "record");

        byte[][] blocks = new byte[TagGeometry.BLOCK_COUNT][TagGeometry.BLOCK_SIZE];

        byte[] material = blocks[MATERIAL_BLOCK];
        TagBytes.writeString(material, MATERIAL_VARIANT_OFFSET, MATERIAL_FIELD_WIDTH, r.materialVariantId(), "materialVariantId");
        TagBytes.writeString(material, MATERIAL_ID_OFFSET, MATERIAL_FIELD_WIDTH, r.materialId(), "materialId");

        TagBytes.writeString(blocks[FILAMENT_TYPE_BLOCK], 0, FULL_BLOCK_STRING, r.filamentType(), "filamentType");
        TagBytes.writeString(blocks[DETAILED_TYPE_BLOCK], 0, FULL_BLOCK_STRING, r.detailedFilamentType(), "detailedFilamentType");

        byte[] physical = blocks[PHYSICAL_BLOCK];
        FilamentColor c = r.color();
        physical[COLOR_OFFSET] = (byte) c.red();
        physical[COLOR_OFFSET + 1] = (byte) c.green();
        physical[COLOR_OFFSET + 2] = (byte) c.blue();
        physical[COLOR_OFFSET + 3] = (byte) c.alpha();
        TagBytes.writeUint16(physical, SPOOL_WEIGHT_OFFSET, r.spoolWeightG(), "spoolWeightG");
        TagBytes.writeFloat32(physical, DIAMETER_OFFSET, r.filamentDiameterMm(), "filamentDiameterMm");

        byte[] temps = blocks[TEMPERATURE_BLOCK];
        TagBytes.writeUint16(temps, DRYING_TEMP_OFFSET, r.dryingTempC(), "dryingTempC");
        TagBytes.writeUint16(temps, DRYING_TIME_OFFSET, r.dryingTimeH(), "dryingTimeH");
        TagBytes.writeUint16(temps, BED_TEMP_TYPE_OFFSET, r.bedTempType(), "bedTempType");
        TagBytes.writeUint16(temps, BED_TEMP_OFFSET, r.bedTempC(), "bedTempC");
        TagBytes.writeUint16(temps, MAX_HOTEND_OFFSET, r.maxHotendTempC(), "maxHotendTempC");
        TagBytes.writeUint16(temps, MIN_HOTEND_OFFSET, r.minHotendTempC(), "minHotendTempC");

        TagBytes.writeFloat32(blocks[NOZZLE_BLOCK], NOZZLE_OFFSET, r.nozzleDiameter(), "nozzleDiameter");
        TagBytes.writeString(blocks[TRAY_UID_BLOCK], 0, FULL_BLOCK_STRING, r.trayUid(), "trayUid");
        TagBytes.writeUint16(blocks[SPOOL_WIDTH_BLOCK], SPOOL_WIDTH_OFFSET, spoolWidthRaw(r.spoolWidthMm()), "spoolWidthMm");

        TagBytes.writeString(blocks[PRODUCTION_DATETIME_BLOCK], 0, FULL_BLOCK_STRING, r.productionDateTime(), "productionDateTime");
        TagBytes.writeString(blocks[SHORT_DATETIME_BLOCK], 0, FULL_BLOCK_STRING, r.shortProductionDateTime(), "shortProductionDateTime");
        TagBytes.writeUint16(blocks[LENGTH_BLOCK], LENGTH_OFFSET, r.filamentLengthM(), "filamentLengthM");

        byte[] multicolor = blocks[MULTICOLOR_BLOCK];
        TagBytes.writeUint16(multicolor, COLOR_FORMAT_OFFSET, r.colorFormat(), "colorFormat");
        TagBytes.writeUint16(multicolor, COLOR_COUNT_OFFSET, r.colorCount(), "colorCount");
        if (r.colorFormat() == FilamentRecord.COLOR_FORMAT_DUAL && r.secondaryColor().isPresent()) {
            FilamentColor s = r.secondaryColor().get();
            multicolor[SECONDARY_COLOR_OFFSET] = (byte) s.alpha();
            multicolor[SECONDARY_COLOR_OFFSET + 1] = (byte) s.blue();
            multicolor[SECONDARY_COLOR_OFFSET + 2] = (byte) s.green();
            multicolor[SECONDARY_COLOR_OFFSET + 3] = (byte) s.red();
        }

        List<Block> out = new ArrayList<>(TagGeometry.BLOCK_COUNT);
        for (byte[] b : blocks) {
            out.add(Block.of(b));
        }
        return TagImage.of(out);
    }

    private static int spoolWidthRaw(double widthMm) {
        if (!Double.isFinite(widthMm)) {
            throw new FieldOutOfRangeException("spoolWidthMm", "value " + widthMm + " is not finite");
        }
        long raw = Math.round(widthMm * SPOOL_WIDTH_SCALE);
        if (raw < 0 || raw > TagBytes.UINT16_MAX) {
            throw new FieldOutOfRangeException("spoolWidthMm", "value " + widthMm + " outside 0.." + (TagBytes.UINT16_MAX / SPOOL_WIDTH_SCALE));
        }
        return (int) raw;
    }
}
