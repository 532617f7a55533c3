package com.questrail.spooltag.crypto;

import com.questrail.spooltag.tag.KeySet;
import com.questrail.spooltag.tag.SectorKey;
import com.questrail.spooltag.tag.TagGeometry;
import com.questrail.spooltag.tag.TagUid;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.params.HKDFParameters;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * KeyDerivation
 * =============================================================================
 * Derives the 16 sector keys of a tag from its uid.
 *
 * <h2>Construction</h2>
 * <pre>
 *   okm  = HKDF-SHA256(salt = master secret, ikm = uid, info = context, L = 96)
 *   key[n] = okm[6n .. 6n + 6)     for n in 0..15
 * </pre>
 *
 * <h2>Properties</h2>
 * <ul>
 *   <li>Deterministic: the server and the agent derive identical keys
 *       independently of any session.</li>
 *   <li>Stateless: instances hold only the immutable {@link KeyDerivationConfig}
 *       and are safe to share.</li>
 * </ul>
 */
public final class KeyDerivation
{
    private static final int OUTPUT_SIZE = TagGeometry.SECTOR_COUNT * TagGeometry.KEY_SIZE;

    private final KeyDerivationConfig config;

    public KeyDerivation(KeyDerivationConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Derives the key set for raw uid bytes. Any non-empty length is accepted.
     *
     * @throws InvalidInputException if {@code uid} is null or empty
     */
    public KeySet derive(byte[] uid) {
        if (uid == null || uid.length == 0) {
            throw new InvalidInputException("uid must not be empty");
        }

        HKDFBytesGenerator hkdf = new HKDFBytesGenerator(new SHA256Digest());
        hkdf.init(new HKDFParameters(uid, config.masterSecret(), config.context()));

        byte[] okm = new byte[OUTPUT_SIZE];
        hkdf.generateBytes(okm, 0, okm.length);

        List<SectorKey> keys = new ArrayList<>(TagGeometry.SECTOR_COUNT);
        for (int i = 0; i < TagGeometry.SECTOR_COUNT; i++) {
            int from = i * TagGeometry.KEY_SIZE;
            keys.add(SectorKey.of(Arrays.copyOfRange(okm, from, from + TagGeometry.KEY_SIZE)));
        }
        Arrays.fill(okm, (byte) 0);
        return KeySet.of(keys);
    }

    public KeySet derive(TagUid uid) {
        Objects.requireNonNull(uid, "uid");
        return derive(uid.toBytes());
    }

    /**
     * Derives from a hex uid such as {@code "DEADBEEF"}. Case and surrounding
     * whitespace are ignored.
     *
     * @throws InvalidInputException if the string is empty or not hex
     */
    public KeySet deriveFromHex(String uidHex) {
        if (uidHex == null || uidHex.isBlank()) {
            throw new InvalidInputException("uid must not be empty");
        }
        final byte[] uid;
        try {
            uid = Hex.decode(uidHex.trim());
        } catch (DecoderException e) {
            throw new InvalidInputException("uid is not valid hex: " + uidHex, e);
        }
        return derive(uid);
    }
}
