package com.questrail.spooltag.tag;

import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/**
 * SectorKey
 * -----------------------------------------------------------------------------
 * Exactly 6 bytes of sector authentication material.
 *
 * <p>{@link #toString()} never prints the key. Use {@link #toHex()} only where
 * the key must cross the wire.</p>
 */
public final class SectorKey
{
    private final byte[] bytes;

    private SectorKey(byte[] bytes) {
        this.bytes = bytes;
    }

    public static SectorKey of(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length != TagGeometry.KEY_SIZE) {
            throw new IllegalArgumentException("sector key must be " + TagGeometry.KEY_SIZE + " bytes, got " + bytes.length);
        }
        return new SectorKey(bytes.clone());
    }

    public static SectorKey fromHex(String hex) {
        Objects.requireNonNull(hex, "hex");
        if (hex.length() != TagGeometry.KEY_SIZE * 2) {
            throw new IllegalArgumentException("sector key must be 12 hex characters, got " + hex.length());
        }
        try {
            return new SectorKey(Hex.decode(hex));
        } catch (DecoderException e) {
            throw new IllegalArgumentException("sector key is not valid hex", e);
        }
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    public String toHex() {
        return Hex.toHexString(bytes).toUpperCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SectorKey other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "SectorKey[******]";
    }
}
