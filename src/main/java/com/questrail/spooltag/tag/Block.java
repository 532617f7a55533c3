package com.questrail.spooltag.tag;

import org.bouncycastle.util.encoders.Hex;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable 16-byte block.
 */
public final class Block
{
    private static final Block ZERO = new Block(new byte[TagGeometry.BLOCK_SIZE]);

    private final byte[] bytes;

    private Block(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * @throws MalformedImageException if {@code bytes} is not exactly 16 bytes long
     */
    public static Block of(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length != TagGeometry.BLOCK_SIZE) {
            throw new MalformedImageException("block must be " + TagGeometry.BLOCK_SIZE + " bytes, got " + bytes.length);
        }
        return new Block(bytes.clone());
    }

    public static Block zero() {
        return ZERO;
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    /** Unsigned byte at {@code offset}. */
    public int unsignedByte(int offset) {
        return bytes[offset] & 0xFF;
    }

    public byte[] slice(int offset, int length) {
        return Arrays.copyOfRange(bytes, offset, offset + length);
    }

    public boolean isZero() {
        for (byte b : bytes) {
            if (b != 0) {
                return false;
            }
        }
        return true;
    }

    public String toHex() {
        return Hex.toHexString(bytes).toUpperCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Block other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "Block[" + toHex() + "]";
    }
}
