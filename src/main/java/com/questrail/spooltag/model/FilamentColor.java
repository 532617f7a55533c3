package com.questrail.spooltag.model;

import java.util.Locale;

/**
 * RGBA color, one unsigned byte per channel.
 */
public record FilamentColor(int red, int green, int blue, int alpha)
{
    public FilamentColor {
        checkChannel("red", red);
        checkChannel("green", green);
        checkChannel("blue", blue);
        checkChannel("alpha", alpha);
    }

    public static FilamentColor opaque(int red, int green, int blue) {
        return new FilamentColor(red, green, blue, 0xFF);
    }

    /** Parses {@code #RRGGBB} or {@code #RRGGBBAA}; the leading '#' is optional. */
    public static FilamentColor fromHex(String hex) {
        String h = hex.startsWith("#") ? hex.substring(1) : hex;
        if (h.length() != 6 && h.length() != 8) {
            throw new IllegalArgumentException("color must be #RRGGBB or #RRGGBBAA: " + hex);
        }
        int r = Integer.parseInt(h.substring(0, 2), 16);
        int g = Integer.parseInt(h.substring(2, 4), 16);
        int b = Integer.parseInt(h.substring(4, 6), 16);
        int a = h.length() == 8 ? Integer.parseInt(h.substring(6, 8), 16) : 0xFF;
        return new FilamentColor(r, g, b, a);
    }

    /** {@code #RRGGBB}, alpha omitted. */
    public String toHex() {
        return String.format(Locale.ROOT, "#%02X%02X%02X", red, green, blue);
    }

    private static void checkChannel(String name, int value) {
        if (value < 0 || value > 0xFF) {
            throw new IllegalArgumentException(name + " must be 0..255, got " + value);
        }
    }
}
