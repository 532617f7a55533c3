package com.questrail.spooltag.agent;

import com.questrail.spooltag.tag.Block;
import com.questrail.spooltag.tag.SectorKey;
import com.questrail.spooltag.tag.TagGeometry;
import com.questrail.spooltag.tag.TagImage;
import com.questrail.spooltag.tag.TagUid;
import com.questrail.spooltag.tag.TestImages;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * In-memory MIFARE Classic 1K tag. Keys come from the trailers of the image it
 * is created with; a sector opens only for the key its trailer holds.
 */
final class SimulatedMifareTag implements MifareClassicTag
{
    private final byte[][] blocks = new byte[TagGeometry.BLOCK_COUNT][];
    private final boolean uidRewritable;
    private final List<Integer> writtenBlocks = new ArrayList<>();
    private final Set<Integer> lockedSectors = new HashSet<>();

    private int authenticatedSector = -1;
    private int operationsBeforeRemoval = Integer.MAX_VALUE;

    SimulatedMifareTag(TagImage image) {
        this(image, false);
    }

    SimulatedMifareTag(TagImage image, boolean uidRewritable) {
        for (int i = 0; i < TagGeometry.BLOCK_COUNT; i++) {
            blocks[i] = image.block(i).toBytes();
        }
        this.uidRewritable = uidRewritable;
    }

    /** No key opens these sectors. */
    SimulatedMifareTag lock(int... sectors) {
        for (int s : sectors) {
            lockedSectors.add(s);
        }
        return this;
    }

    /** The tag leaves the field after {@code count} further operations. */
    SimulatedMifareTag removeAfter(int count) {
        this.operationsBeforeRemoval = count;
        return this;
    }

    TagImage image() {
        List<Block> out = new ArrayList<>();
        for (byte[] b : blocks) {
            out.add(Block.of(b));
        }
        return TagImage.of(out);
    }

    List<Integer> writtenBlocks() {
        return writtenBlocks;
    }

    @Override
    public TagUid uid() {
        return TagUid.of(Arrays.copyOf(blocks[0], TagGeometry.UID_SIZE));
    }

    @Override
    public boolean authenticateSectorWithKeyA(int sector, SectorKey key) throws IOException {
        return authenticate(sector, key, true);
    }

    @Override
    public boolean authenticateSectorWithKeyB(int sector, SectorKey key) throws IOException {
        return authenticate(sector, key, false);
    }

    @Override
    public byte[] readBlock(int block) throws IOException {
        tick();
        requireAuthenticated(block);
        return blocks[block].clone();
    }

    @Override
    public void writeBlock(int block, byte[] data) throws IOException {
        tick();
        requireAuthenticated(block);
        blocks[block] = data.clone();
        writtenBlocks.add(block);
    }

    @Override
    public boolean supportsUidRewrite() {
        return uidRewritable;
    }

    @Override
    public void rewriteUid(TagUid uid) throws IOException {
        if (!uidRewritable) {
            throw new UnsupportedOperationException("uid rewrite not supported");
        }
        tick();
        System.arraycopy(uid.toBytes(), 0, blocks[0], 0, TagGeometry.UID_SIZE);
    }

    private boolean authenticate(int sector, SectorKey key, boolean keyA) throws IOException {
        tick();
        authenticatedSector = -1;
        if (lockedSectors.contains(sector)) {
            return false;
        }
        Block trailer = Block.of(blocks[TagGeometry.sectorTrailerBlock(sector)]);
        SectorKey stored = keyA ? TestImages.trailerKeyA(trailer) : TestImages.trailerKeyB(trailer);
        if (stored.equals(key)) {
            authenticatedSector = sector;
            return true;
        }
        return false;
    }

    private void requireAuthenticated(int block) throws IOException {
        if (TagGeometry.blockToSector(block) != authenticatedSector) {
            throw new IOException("block " + block + " not authenticated");
        }
    }

    private void tick() throws IOException {
        if (operationsBeforeRemoval-- <= 0) {
            throw new IOException("tag left the field");
        }
    }
}
