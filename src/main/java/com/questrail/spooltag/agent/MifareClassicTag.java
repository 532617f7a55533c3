package com.questrail.spooltag.agent;

import com.questrail.spooltag.tag.SectorKey;
import com.questrail.spooltag.tag.TagUid;

import java.io.IOException;

/**
 * MifareClassicTag
 * -----------------------------------------------------------------------------
 * Port onto a MIFARE Classic 1K tag currently in the reader's field.
 *
 * <p>Authentication is per sector and stays in effect for that sector's blocks
 * until another sector is authenticated. An {@link IOException} means the tag
 * left the field or the reader failed; a rejected key is a {@code false}
 * return, not an exception.</p>
 */
public interface MifareClassicTag
{
    TagUid uid();

    boolean authenticateSectorWithKeyA(int sector, SectorKey key) throws IOException;

    boolean authenticateSectorWithKeyB(int sector, SectorKey key) throws IOException;

    /** @return the 16 bytes of {@code block} */
    byte[] readBlock(int block) throws IOException;

    void writeBlock(int block, byte[] data) throws IOException;

    /**
     * Whether this tag and reader can change the tag identifier
     * (so-called magic tags).
     */
    default boolean supportsUidRewrite() {
        return false;
    }

    /**
     * @throws UnsupportedOperationException if {@link #supportsUidRewrite()} is false
     */
    default void rewriteUid(TagUid uid) throws IOException {
        throw new UnsupportedOperationException("uid rewrite not supported");
    }
}
