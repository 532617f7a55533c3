package com.questrail.spooltag.tag;

import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/**
 * TagUid
 * -----------------------------------------------------------------------------
 * Immutable 4-byte factory identifier of a physical tag.
 *
 * <p>The uid is the only secret-independent input to key derivation. Its wire
 * form is 8 upper-case hex characters.</p>
 */
public final class TagUid
{
    private final byte[] bytes;

    private TagUid(byte[] bytes) {
        this.bytes = bytes;
    }

    public static TagUid of(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length != TagGeometry.UID_SIZE) {
            throw new IllegalArgumentException("uid must be " + TagGeometry.UID_SIZE + " bytes, got " + bytes.length);
        }
        return new TagUid(bytes.clone());
    }

    /**
     * Parses an 8 hex character uid. Case is ignored.
     *
     * @throws IllegalArgumentException if the string is not exactly 4 bytes of hex
     */
    public static TagUid fromHex(String hex) {
        Objects.requireNonNull(hex, "hex");
        String clean = hex.trim();
        if (clean.length() != TagGeometry.UID_SIZE * 2) {
            throw new IllegalArgumentException("uid must be 8 hex characters: " + hex);
        }
        try {
            return new TagUid(Hex.decode(clean));
        } catch (DecoderException e) {
            throw new IllegalArgumentException("uid is not valid hex: " + hex, e);
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
        if (!(o instanceof TagUid other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
