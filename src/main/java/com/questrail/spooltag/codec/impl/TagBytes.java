package com.questrail.spooltag.codec.impl;

import com.questrail.spooltag.codec.FieldOutOfRangeException;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * TagBytes
 * -----------------------------------------------------------------------------
 * Little-endian and fixed-width ASCII primitives over 16-byte block buffers.
 *
 * <p>Readers are lenient (the tag is authoritative). Writers are strict and
 * throw {@link FieldOutOfRangeException} instead of truncating.</p>
 */
final class TagBytes
{
    static final int UINT16_MAX = 0xFFFF;

    private TagBytes() {}

    static int readUint16(byte[] block, int offset) {
        return (block[offset] & 0xFF) | ((block[offset + 1] & 0xFF) << 8);
    }

    static float readFloat32(byte[] block, int offset) {
        return ByteBuffer.wrap(block, offset, 4).order(ByteOrder.LITTLE_ENDIAN).getFloat();
    }

    /**
     * Reads a NUL-terminated ASCII string from a fixed-width slot: cut at the
     * first NUL (or use the whole slot), then strip surrounding whitespace.
     * Non-ASCII bytes decode to U+FFFD.
     */
    static String readString(byte[] block, int offset, int width) {
        int end = offset;
        int limit = offset + width;
        while (end < limit && block[end] != 0) {
            end++;
        }
        return new String(block, offset, end - offset, StandardCharsets.US_ASCII).strip();
    }

    static void writeUint16(byte[] block, int offset, int value, String field) {
        if (value < 0 || value > UINT16_MAX) {
            throw new FieldOutOfRangeException(field, "value " + value + " outside 0.." + UINT16_MAX);
        }
        block[offset] = (byte) (value & 0xFF);
        block[offset + 1] = (byte) ((value >>> 8) & 0xFF);
    }

    static void writeFloat32(byte[] block, int offset, float value, String field) {
        if (!Float.isFinite(value)) {
            throw new FieldOutOfRangeException(field, "value " + value + " is not finite");
        }
        ByteBuffer.wrap(block, offset, 4).order(ByteOrder.LITTLE_ENDIAN).putFloat(value);
    }

    /**
     * Writes {@code value} NUL padded into a slot of {@code width} bytes.
     */
    static void writeString(byte[] block, int offset, int width, String value, String field) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == 0 || c > 0x7F) {
                throw new FieldOutOfRangeException(field, "non-ASCII or NUL character at index " + i);
            }
        }
        byte[] ascii = value.getBytes(StandardCharsets.US_ASCII);
        if (ascii.length > width) {
            throw new FieldOutOfRangeException(field, "length " + ascii.length + " exceeds slot of " + width);
        }
        System.arraycopy(ascii, 0, block, offset, ascii.length);
        for (int i = offset + ascii.length; i < offset + width; i++) {
            block[i] = 0;
        }
    }
}
