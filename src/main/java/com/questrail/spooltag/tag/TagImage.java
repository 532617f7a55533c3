package com.questrail.spooltag.tag;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * TagImage
 * =============================================================================
 * Immutable, complete 64-block (1024 byte) image of a tag.
 *
 * <h2>Invariant</h2>
 * An instance always holds exactly {@link TagGeometry#BLOCK_COUNT} blocks of
 * exactly {@link TagGeometry#BLOCK_SIZE} bytes. Every factory enforces this and
 * fails with {@link MalformedImageException} otherwise.
 *
 * <h2>Payload vs. structure</h2>
 * Block 0 (manufacturer data) and the sector trailers are structural. The rest
 * is payload. {@link #payloadOnly()} and {@link #withPayloadFrom(TagImage)} are
 * the two operations used when building writable images: encoders produce a
 * payload-only image, callers merge it over a template that supplies block 0
 * and the trailers.
 */
public final class TagImage
{
    private final List<Block> blocks;

    private TagImage(List<Block> blocks) {
        this.blocks = blocks;
    }

    public static TagImage of(List<Block> blocks) {
        Objects.requireNonNull(blocks, "blocks");
        if (blocks.size() != TagGeometry.BLOCK_COUNT) {
            throw new MalformedImageException("expected " + TagGeometry.BLOCK_COUNT + " blocks, got " + blocks.size());
        }
        for (int i = 0; i < blocks.size(); i++) {
            if (blocks.get(i) == null) {
                throw new MalformedImageException("block " + i + " is missing");
            }
        }
        return new TagImage(List.copyOf(blocks));
    }

    /** Splits a raw 1024-byte dump into blocks. */
    public static TagImage fromBytes(byte[] data) {
        Objects.requireNonNull(data, "data");
        if (data.length != TagGeometry.IMAGE_SIZE) {
            throw new MalformedImageException("expected " + TagGeometry.IMAGE_SIZE + " bytes, got " + data.length);
        }
        List<Block> blocks = new ArrayList<>(TagGeometry.BLOCK_COUNT);
        for (int i = 0; i < TagGeometry.BLOCK_COUNT; i++) {
            int from = i * TagGeometry.BLOCK_SIZE;
            blocks.add(Block.of(Arrays.copyOfRange(data, from, from + TagGeometry.BLOCK_SIZE)));
        }
        return new TagImage(Collections.unmodifiableList(blocks));
    }

    public static TagImage blank() {
        return new TagImage(Collections.nCopies(TagGeometry.BLOCK_COUNT, Block.zero()));
    }

    public Block block(int address) {
        TagGeometry.checkBlock(address);
        return blocks.get(address);
    }

    public List<Block> blocks() {
        return blocks;
    }

    /** The 4 blocks of a sector, trailer last. */
    public List<Block> sector(int sector) {
        int first = TagGeometry.sectorToBlock(sector);
        return blocks.subList(first, first + TagGeometry.BLOCKS_PER_SECTOR);
    }

    /** Uid carried in block 0, bytes 0..3. */
    public TagUid uid() {
        return TagUid.of(blocks.get(0).slice(0, TagGeometry.UID_SIZE));
    }

    public TagImage withBlock(int address, Block block) {
        TagGeometry.checkBlock(address);
        Objects.requireNonNull(block, "block");
        List<Block> copy = new ArrayList<>(blocks);
        copy.set(address, block);
        return new TagImage(Collections.unmodifiableList(copy));
    }

    /**
     * Returns a copy with block 0 and all sector trailers zeroed.
     */
    public TagImage payloadOnly() {
        List<Block> copy = new ArrayList<>(blocks);
        for (int i = 0; i < copy.size(); i++) {
            if (!TagGeometry.isPayloadBlock(i)) {
                copy.set(i, Block.zero());
            }
        }
        return new TagImage(Collections.unmodifiableList(copy));
    }

    /**
     * Returns a copy of this image (the template) with every payload block
     * replaced by the corresponding block of {@code payload}. Block 0 and the
     * trailers of the template are kept.
     */
    public TagImage withPayloadFrom(TagImage payload) {
        Objects.requireNonNull(payload, "payload");
        List<Block> copy = new ArrayList<>(blocks);
        for (int i = 0; i < copy.size(); i++) {
            if (TagGeometry.isPayloadBlock(i)) {
                copy.set(i, payload.blocks.get(i));
            }
        }
        return new TagImage(Collections.unmodifiableList(copy));
    }

    public byte[] toBytes() {
        byte[] out = new byte[TagGeometry.IMAGE_SIZE];
        for (int i = 0; i < blocks.size(); i++) {
            System.arraycopy(blocks.get(i).toBytes(), 0, out, i * TagGeometry.BLOCK_SIZE, TagGeometry.BLOCK_SIZE);
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TagImage other)) return false;
        return blocks.equals(other.blocks);
    }

    @Override
    public int hashCode() {
        return blocks.hashCode();
    }

    @Override
    public String toString() {
        return "TagImage[uid=" + uid() + "]";
    }
}
