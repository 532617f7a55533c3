package com.questrail.spooltag.tag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * TagGeometry
 * =============================================================================
 * Fixed geometry of the 1 KB, 16-sector tag used by filament spools.
 *
 * <pre>
 *   16 sectors x 4 blocks x 16 bytes = 1024 bytes
 *   block 0               : manufacturer data (uid in bytes 0..3)
 *   block 4n + 3          : sector trailer (key A, access bits, key B)
 * </pre>
 *
 * <p>Neither block 0 nor any sector trailer is ever payload-writable.</p>
 */
public final class TagGeometry
{
    public static final int SECTOR_COUNT = 16;
    public static final int BLOCKS_PER_SECTOR = 4;
    public static final int BLOCK_SIZE = 16;
    public static final int BLOCK_COUNT = SECTOR_COUNT * BLOCKS_PER_SECTOR;
    public static final int IMAGE_SIZE = BLOCK_COUNT * BLOCK_SIZE;

    public static final int KEY_SIZE = 6;
    public static final int UID_SIZE = 4;

    private TagGeometry() {}

    /** First block address of the given sector. */
    public static int sectorToBlock(int sector) {
        checkSector(sector);
        return sector * BLOCKS_PER_SECTOR;
    }

    public static int blockToSector(int block) {
        checkBlock(block);
        return block / BLOCKS_PER_SECTOR;
    }

    public static boolean isSectorTrailer(int block) {
        checkBlock(block);
        return (block + 1) % BLOCKS_PER_SECTOR == 0;
    }

    public static int sectorTrailerBlock(int sector) {
        return sectorToBlock(sector) + BLOCKS_PER_SECTOR - 1;
    }

    /**
     * Returns true if the block may carry writer-controlled payload: neither the
     * manufacturer block nor a sector trailer.
     */
    public static boolean isPayloadBlock(int block) {
        return block != 0 && !isSectorTrailer(block);
    }

    /** Non-trailer blocks of a sector, in address order. */
    public static List<Integer> dataBlocksForSector(int sector) {
        int first = sectorToBlock(sector);
        List<Integer> blocks = new ArrayList<>(BLOCKS_PER_SECTOR - 1);
        for (int i = 0; i < BLOCKS_PER_SECTOR - 1; i++) {
            blocks.add(first + i);
        }
        return Collections.unmodifiableList(blocks);
    }

    static void checkSector(int sector) {
        if (sector < 0 || sector >= SECTOR_COUNT) {
            throw new IllegalArgumentException("sector out of range: " + sector);
        }
    }

    static void checkBlock(int block) {
        if (block < 0 || block >= BLOCK_COUNT) {
            throw new IllegalArgumentException("block out of range: " + block);
        }
    }
}
