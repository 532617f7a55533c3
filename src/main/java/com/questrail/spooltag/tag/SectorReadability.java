package com.questrail.spooltag.tag;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * SectorReadability
 * -----------------------------------------------------------------------------
 * Per-sector readability mask carried alongside a read image.
 *
 * <p>Unreadable sectors are zero-filled in the image. The mask is what tells
 * "unreadable" apart from "intentionally zero"; callers must not infer
 * readability from block contents.</p>
 */
public final class SectorReadability
{
    private static final int ALL = (1 << TagGeometry.SECTOR_COUNT) - 1;

    private static final SectorReadability ALL_READABLE = new SectorReadability(ALL);

    /** Bit n set = sector n was read. */
    private final int mask;

    private SectorReadability(int mask) {
        this.mask = mask;
    }

    public static SectorReadability allReadable() {
        return ALL_READABLE;
    }

    public static SectorReadability fromMask(int mask) {
        if ((mask & ~ALL) != 0) {
            throw new IllegalArgumentException("mask has bits beyond sector 15: " + Integer.toHexString(mask));
        }
        return new SectorReadability(mask);
    }

    public static SectorReadability withUnreadable(Collection<Integer> unreadableSectors) {
        Objects.requireNonNull(unreadableSectors, "unreadableSectors");
        int m = ALL;
        for (int s : unreadableSectors) {
            TagGeometry.checkSector(s);
            m &= ~(1 << s);
        }
        return new SectorReadability(m);
    }

    public boolean isReadable(int sector) {
        TagGeometry.checkSector(sector);
        return (mask & (1 << sector)) != 0;
    }

    public boolean isComplete() {
        return mask == ALL;
    }

    public List<Integer> unreadableSectors() {
        List<Integer> out = new ArrayList<>();
        for (int s = 0; s < TagGeometry.SECTOR_COUNT; s++) {
            if (!isReadable(s)) {
                out.add(s);
            }
        }
        return out;
    }

    public int mask() {
        return mask;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SectorReadability other && other.mask == mask;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(mask);
    }

    @Override
    public String toString() {
        return "SectorReadability[unreadable=" + unreadableSectors() + "]";
    }
}
