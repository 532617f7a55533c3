package com.questrail.spooltag.tag;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builds tag images shaped like factory tags for tests.
 */
public final class TestImages
{
    /** Factory access bits used on production tags. */
    public static final byte[] ACCESS_BITS = {(byte) 0x87, (byte) 0x87, (byte) 0x87, 0x69};

    // Trailer layout: key A, access bits, key B
    private static final int KEY_A_OFFSET = 0;
    private static final int ACCESS_BITS_OFFSET = 6;
    private static final int KEY_B_OFFSET = 10;

    private TestImages() {}

    /**
     * A blank image whose block 0 carries {@code uid} and whose trailers hold
     * the given per-sector keys as both key A and key B.
     */
    public static TagImage template(TagUid uid, KeySet keys) {
        List<Block> blocks = new ArrayList<>(TagGeometry.BLOCK_COUNT);
        for (int i = 0; i < TagGeometry.BLOCK_COUNT; i++) {
            blocks.add(Block.zero());
        }
        byte[] b0 = new byte[TagGeometry.BLOCK_SIZE];
        System.arraycopy(uid.toBytes(), 0, b0, 0, TagGeometry.UID_SIZE);
        b0[4] = xorOf(uid.toBytes());
        b0[5] = 0x08;
        blocks.set(0, Block.of(b0));
        for (int s = 0; s < TagGeometry.SECTOR_COUNT; s++) {
            blocks.set(TagGeometry.sectorTrailerBlock(s), trailer(keys.get(s), keys.get(s)));
        }
        return TagImage.of(blocks);
    }

    public static Block trailer(SectorKey keyA, SectorKey keyB) {
        byte[] t = new byte[TagGeometry.BLOCK_SIZE];
        System.arraycopy(keyA.toBytes(), 0, t, KEY_A_OFFSET, TagGeometry.KEY_SIZE);
        System.arraycopy(ACCESS_BITS, 0, t, ACCESS_BITS_OFFSET, ACCESS_BITS.length);
        System.arraycopy(keyB.toBytes(), 0, t, KEY_B_OFFSET, TagGeometry.KEY_SIZE);
        return Block.of(t);
    }

    public static SectorKey trailerKeyA(Block trailer) {
        return SectorKey.of(trailer.slice(KEY_A_OFFSET, TagGeometry.KEY_SIZE));
    }

    public static SectorKey trailerKeyB(Block trailer) {
        return SectorKey.of(trailer.slice(KEY_B_OFFSET, TagGeometry.KEY_SIZE));
    }

    /** A block filled with {@code value}. */
    public static Block filled(int value) {
        byte[] b = new byte[TagGeometry.BLOCK_SIZE];
        Arrays.fill(b, (byte) value);
        return Block.of(b);
    }

    private static byte xorOf(byte[] bytes) {
        byte x = 0;
        for (byte v : bytes) {
            x ^= v;
        }
        return x;
    }
}
