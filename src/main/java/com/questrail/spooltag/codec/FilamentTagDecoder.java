package com.questrail.spooltag.codec;

import com.questrail.spooltag.model.FilamentRecord;
import com.questrail.spooltag.tag.Block;
import com.questrail.spooltag.tag.MalformedImageException;
import com.questrail.spooltag.tag.TagImage;

import java.util.List;

/**
 * FilamentTagDecoder
 * -----------------------------------------------------------------------------
 * Positional decoder from a complete tag image to a {@link FilamentRecord}.
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Extracting fields at their fixed block and byte offsets</li>
 *   <li>Detecting the presence of a signature in sectors 10..15</li>
 * </ul>
 *
 * <p>It does not authenticate, verify the signature, or interpret
 * readability; unreadable sectors simply decode as zero.</p>
 */
public interface FilamentTagDecoder
{
    /**
     * Decode a complete image. Total over correctly sized input.
     */
    FilamentRecord decode(TagImage image);

    /**
     * Decode a raw block list.
     *
     * @throws MalformedImageException if the list does not hold exactly 64 blocks
     */
    default FilamentRecord decode(List<Block> blocks) {
        return decode(TagImage.of(blocks));
    }
}
