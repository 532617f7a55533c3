package com.questrail.spooltag.tag;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * KeySet
 * -----------------------------------------------------------------------------
 * Ordered sequence of exactly 16 sector keys, index = physical sector.
 */
public final class KeySet
{
    private final List<SectorKey> keys;

    private KeySet(List<SectorKey> keys) {
        this.keys = keys;
    }

    public static KeySet of(List<SectorKey> keys) {
        Objects.requireNonNull(keys, "keys");
        if (keys.size() != TagGeometry.SECTOR_COUNT) {
            throw new IllegalArgumentException("key set must hold " + TagGeometry.SECTOR_COUNT + " keys, got " + keys.size());
        }
        for (SectorKey k : keys) {
            Objects.requireNonNull(k, "key");
        }
        return new KeySet(List.copyOf(keys));
    }

    /** Parses 16 twelve-character hex keys. */
    public static KeySet fromHex(List<String> hexKeys) {
        Objects.requireNonNull(hexKeys, "hexKeys");
        List<SectorKey> parsed = new ArrayList<>(hexKeys.size());
        for (String h : hexKeys) {
            parsed.add(SectorKey.fromHex(h));
        }
        return of(parsed);
    }

    public SectorKey get(int sector) {
        TagGeometry.checkSector(sector);
        return keys.get(sector);
    }

    public List<SectorKey> keys() {
        return keys;
    }

    public List<String> toHex() {
        List<String> out = new ArrayList<>(keys.size());
        for (SectorKey k : keys) {
            out.add(k.toHex());
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof KeySet other)) return false;
        return keys.equals(other.keys);
    }

    @Override
    public int hashCode() {
        return keys.hashCode();
    }

    @Override
    public String toString() {
        return "KeySet[16 keys]";
    }
}
