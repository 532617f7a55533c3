package com.questrail.spooltag.bridge;

import com.questrail.spooltag.model.FilamentRecord;
import com.questrail.spooltag.tag.SectorReadability;
import com.questrail.spooltag.tag.TagImage;
import com.questrail.spooltag.tag.TagUid;

import java.util.Objects;

/**
 * Outcome of a successful read: the raw image as the agent returned it, which
 * sectors it could actually read, and the decoded filament record.
 *
 * <p>Unreadable sectors are zero-filled in {@code image}; fields decoded from
 * them read as zero or empty in {@code record}.</p>
 */
public record TagReadResult(TagUid uid,
                            TagImage image,
                            SectorReadability readability,
                            FilamentRecord record)
{
    public TagReadResult {
        Objects.requireNonNull(uid, "uid");
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(readability, "readability");
        Objects.requireNonNull(record, "record");
    }

    public boolean isComplete() {
        return readability.isComplete();
    }
}
