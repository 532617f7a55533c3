package com.questrail.spooltag.agent;

import com.questrail.spooltag.crypto.KeyDerivation;
import com.questrail.spooltag.tag.Block;
import com.questrail.spooltag.tag.KeySet;
import com.questrail.spooltag.tag.SectorKey;
import com.questrail.spooltag.tag.SectorReadability;
import com.questrail.spooltag.tag.TagGeometry;
import com.questrail.spooltag.tag.TagImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * TagOperations
 * =============================================================================
 * Sector-by-sector read and write of a MIFARE Classic 1K tag.
 *
 * <h2>Read</h2>
 * For each sector: the request's key (or one derived from the tag uid) as key
 * A, then as key B, then each fallback key as key A. A sector no key opens is
 * zero-filled and marked unreadable; the read still returns all 64 blocks.
 *
 * <h2>Write</h2>
 * For each sector: the request's key as key A, then as key B. Every block of
 * an opened sector is written except block 0 and the trailer. Sectors that do
 * not open are skipped and only show up in the returned count.
 *
 * <p>{@link IOException} is never caught here; a tag that leaves the field
 * aborts the whole operation.</p>
 */
public final class TagOperations
{
    private static final Logger log = LoggerFactory.getLogger(TagOperations.class);

    /** Image read from a tag plus which sectors could be read. */
    public record ReadOutcome(TagImage image, SectorReadability readability) {
        public ReadOutcome {
            Objects.requireNonNull(image, "image");
            Objects.requireNonNull(readability, "readability");
        }
    }

    private final KeyDerivation keyDerivation;
    private final List<SectorKey> fallbackKeys;

    public TagOperations(AgentConfig config) {
        Objects.requireNonNull(config, "config");
        this.keyDerivation = new KeyDerivation(config.keyDerivation());
        this.fallbackKeys = config.fallbackKeys();
    }

    public ReadOutcome read(MifareClassicTag tag, Optional<KeySet> suppliedKeys) throws IOException {
        Objects.requireNonNull(tag, "tag");
        Objects.requireNonNull(suppliedKeys, "suppliedKeys");

        KeySet keys = suppliedKeys.isPresent() ? suppliedKeys.get() : keyDerivation.derive(tag.uid());

        List<Block> blocks = new ArrayList<>(TagGeometry.BLOCK_COUNT);
        List<Integer> unreadable = new ArrayList<>();

        for (int sector = 0; sector < TagGeometry.SECTOR_COUNT; sector++) {
            if (openForRead(tag, sector, keys.get(sector))) {
                int first = TagGeometry.sectorToBlock(sector);
                for (int b = first; b < first + TagGeometry.BLOCKS_PER_SECTOR; b++) {
                    blocks.add(Block.of(tag.readBlock(b)));
                }
            }
            else {
                unreadable.add(sector);
                for (int b = 0; b < TagGeometry.BLOCKS_PER_SECTOR; b++) {
                    blocks.add(Block.zero());
                }
            }
        }

        if (!unreadable.isEmpty()) {
            log.info("Tag {}: sectors {} unreadable", tag.uid(), unreadable);
        }
        return new ReadOutcome(TagImage.of(blocks), SectorReadability.withUnreadable(unreadable));
    }

    /**
     * @return number of blocks written
     */
    public int write(MifareClassicTag tag, KeySet keys, TagImage image) throws IOException {
        Objects.requireNonNull(tag, "tag");
        Objects.requireNonNull(keys, "keys");
        Objects.requireNonNull(image, "image");

        int written = 0;
        for (int sector = 0; sector < TagGeometry.SECTOR_COUNT; sector++) {
            SectorKey key = keys.get(sector);
            if (!tag.authenticateSectorWithKeyA(sector, key) && !tag.authenticateSectorWithKeyB(sector, key)) {
                log.warn("Tag {}: sector {} rejected key, skipped", tag.uid(), sector);
                continue;
            }
            for (int block : TagGeometry.dataBlocksForSector(sector)) {
                if (!TagGeometry.isPayloadBlock(block)) {
                    continue;
                }
                tag.writeBlock(block, image.block(block).toBytes());
                written++;
            }
        }
        return written;
    }

    private boolean openForRead(MifareClassicTag tag, int sector, SectorKey key) throws IOException {
        if (tag.authenticateSectorWithKeyA(sector, key) || tag.authenticateSectorWithKeyB(sector, key)) {
            return true;
        }
        for (SectorKey fallback : fallbackKeys) {
            if (tag.authenticateSectorWithKeyA(sector, fallback)) {
                return true;
            }
        }
        return false;
    }
}
