package com.questrail.spooltag.codec;

import com.questrail.spooltag.model.FilamentRecord;
import com.questrail.spooltag.tag.TagImage;

/**
 * FilamentTagEncoder
 * -----------------------------------------------------------------------------
 * Inverse of {@link FilamentTagDecoder} for writer-controlled fields.
 *
 * <p>The produced image is payload only: block 0, the sector trailers and the
 * signature sectors are left zero. Use {@link #encodeOnto(FilamentRecord, TagImage)}
 * to obtain a complete image from a template.</p>
 */
public interface FilamentTagEncoder
{
    /**
     * @throws FieldOutOfRangeException if a field does not fit its on-tag slot
     */
    TagImage encode(FilamentRecord record);

    /**
     * Encodes {@code record} and merges its payload blocks over {@code template},
     * which supplies block 0 and the sector trailers.
     */
    default TagImage encodeOnto(FilamentRecord record, TagImage template) {
        return template.withPayloadFrom(encode(record));
    }
}
