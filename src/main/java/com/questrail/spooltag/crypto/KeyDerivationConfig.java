package com.questrail.spooltag.crypto;

import org.bouncycastle.util.encoders.Hex;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * KeyDerivationConfig
 * -----------------------------------------------------------------------------
 * Immutable HKDF parameters: a 16-byte master secret used as salt and a 7-byte
 * context string used as info.
 *
 * <p>Constructed once at startup and passed explicitly to {@link KeyDerivation}.
 * Arrays are copied in and out, so an instance can be shared across threads.</p>
 */
public record KeyDerivationConfig(byte[] masterSecret, byte[] context)
{
    public static final int MASTER_SECRET_SIZE = 16;
    public static final int CONTEXT_SIZE = 7;

    private static final byte[] DEFAULT_MASTER_SECRET = Hex.decode("9A759CF2C4F7CAFF222CB9769B41BC96");
    private static final byte[] DEFAULT_CONTEXT = "RFID-A\0".getBytes(StandardCharsets.US_ASCII);

    public KeyDerivationConfig {
        Objects.requireNonNull(masterSecret, "masterSecret");
        Objects.requireNonNull(context, "context");
        if (masterSecret.length != MASTER_SECRET_SIZE) {
            throw new IllegalArgumentException("masterSecret must be " + MASTER_SECRET_SIZE + " bytes, got " + masterSecret.length);
        }
        if (context.length != CONTEXT_SIZE) {
            throw new IllegalArgumentException("context must be " + CONTEXT_SIZE + " bytes, got " + context.length);
        }
        masterSecret = masterSecret.clone();
        context = context.clone();
    }

    /**
     * The well-known parameters shared by every filament tag.
     */
    public static KeyDerivationConfig defaults() {
        return new KeyDerivationConfig(DEFAULT_MASTER_SECRET, DEFAULT_CONTEXT);
    }

    @Override
    public byte[] masterSecret() {
        return masterSecret.clone();
    }

    @Override
    public byte[] context() {
        return context.clone();
    }

    @Override
    public String toString() {
        return "KeyDerivationConfig[masterSecret=******, context=" + CONTEXT_SIZE + " bytes]";
    }
}
