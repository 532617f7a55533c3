package com.questrail.spooltag.codec.impl;

/**
 * TagLayout
 * -----------------------------------------------------------------------------
 * Block and byte positions of every filament field.
 *
 * <pre>
 *   block  off  len  field                        encoding
 *   0      0    4    uid                          raw
 *   1      0    8    material_variant_id          ASCII, NUL padded
 *   1      8    8    material_id                  ASCII, NUL padded
 *   2      0    16   filament_type                ASCII, NUL padded
 *   4      0    16   detailed_filament_type       ASCII, NUL padded
 *   5      0    4    color                        R, G, B, A
 *   5      4    2    spool_weight_g               uint16 LE
 *   5      8    4    filament_diameter_mm         float32 LE
 *   6      0..  2    drying temp/time, bed type/temp, hotend max/min   uint16 LE
 *   8      12   4    nozzle_diameter              float32 LE
 *   9      0    16   tray_uid                     ASCII, NUL padded
 *   10     4    2    spool_width                  uint16 LE, mm x 100
 *   12     0    16   production_datetime          ASCII, NUL padded
 *   13     0    16   short_production_datetime    ASCII, NUL padded
 *   14     4    2    filament_length_m            uint16 LE
 *   16     0    2    color_format                 uint16 LE
 *   16     2    2    color_count                  uint16 LE
 *   16     4    4    secondary color              A, B, G, R (color_format 2 only)
 * </pre>
 */
final class TagLayout
{
    static final int MATERIAL_BLOCK = 1;
    static final int MATERIAL_VARIANT_OFFSET = 0;
    static final int MATERIAL_ID_OFFSET = 8;
    static final int MATERIAL_FIELD_WIDTH = 8;

    static final int FILAMENT_TYPE_BLOCK = 2;
    static final int DETAILED_TYPE_BLOCK = 4;

    static final int PHYSICAL_BLOCK = 5;
    static final int COLOR_OFFSET = 0;
    static final int SPOOL_WEIGHT_OFFSET = 4;
    static final int DIAMETER_OFFSET = 8;

    static final int TEMPERATURE_BLOCK = 6;
    static final int DRYING_TEMP_OFFSET = 0;
    static final int DRYING_TIME_OFFSET = 2;
    static final int BED_TEMP_TYPE_OFFSET = 4;
    static final int BED_TEMP_OFFSET = 6;
    static final int MAX_HOTEND_OFFSET = 8;
    static final int MIN_HOTEND_OFFSET = 10;

    static final int NOZZLE_BLOCK = 8;
    static final int NOZZLE_OFFSET = 12;

    static final int TRAY_UID_BLOCK = 9;

    static final int SPOOL_WIDTH_BLOCK = 10;
    static final int SPOOL_WIDTH_OFFSET = 4;
    static final double SPOOL_WIDTH_SCALE = 100.0;

    static final int PRODUCTION_DATETIME_BLOCK = 12;
    static final int SHORT_DATETIME_BLOCK = 13;

    static final int LENGTH_BLOCK = 14;
    static final int LENGTH_OFFSET = 4;

    static final int MULTICOLOR_BLOCK = 16;
    static final int COLOR_FORMAT_OFFSET = 0;
    static final int COLOR_COUNT_OFFSET = 2;
    static final int SECONDARY_COLOR_OFFSET = 4;

    static final int FULL_BLOCK_STRING = 16;

    // Signature: first three blocks of sectors 10..15, first 256 bytes used.
    static final int SIGNATURE_FIRST_SECTOR = 10;
    static final int SIGNATURE_LAST_SECTOR = 15;
    static final int SIGNATURE_BYTES = 256;

    private TagLayout() {}
}
