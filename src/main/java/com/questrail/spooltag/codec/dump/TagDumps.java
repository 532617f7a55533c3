package com.questrail.spooltag.codec.dump;

import com.questrail.spooltag.tag.Block;
import com.questrail.spooltag.tag.MalformedImageException;
import com.questrail.spooltag.tag.TagGeometry;
import com.questrail.spooltag.tag.TagImage;

import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * TagDumps
 * =============================================================================
 * Offline representations of a tag image.
 *
 * <h2>Supported formats</h2>
 * <ul>
 *   <li>raw 1024-byte binary</li>
 *   <li>hex string of the whole image (whitespace ignored)</li>
 *   <li>base64 of the whole image</li>
 *   <li>list of 64 base64 blocks</li>
 *   <li>list of 64 hex blocks</li>
 *   <li>Proxmark3 text, one {@code Block NN: AA BB ...} line per block</li>
 * </ul>
 *
 * <p>Every parser produces a {@link TagImage} and fails with
 * {@link MalformedImageException} on any size or encoding defect. The result
 * feeds {@code FilamentTagDecoder} exactly like a hardware read.</p>
 */
public final class TagDumps
{
    private static final int PROXMARK_HEX_CHARS = TagGeometry.BLOCK_SIZE * 2;

    private TagDumps() {}

    // ---------------------------------------------------------------------
    // Parsing
    // ---------------------------------------------------------------------

    public static TagImage fromBinary(byte[] data) {
        return TagImage.fromBytes(data);
    }

    public static TagImage fromHex(String hex) {
        Objects.requireNonNull(hex, "hex");
        return TagImage.fromBytes(decodeHex(hex.replaceAll("\\s+", "")));
    }

    public static TagImage fromBase64(String base64) {
        Objects.requireNonNull(base64, "base64");
        return TagImage.fromBytes(decodeBase64(base64.strip()));
    }

    public static TagImage fromBase64Blocks(List<String> blocks) {
        Objects.requireNonNull(blocks, "blocks");
        List<Block> parsed = new ArrayList<>(blocks.size());
        for (String b : blocks) {
            parsed.add(Block.of(decodeBase64(b)));
        }
        return TagImage.of(parsed);
    }

    public static TagImage fromHexBlocks(List<String> blocks) {
        Objects.requireNonNull(blocks, "blocks");
        List<Block> parsed = new ArrayList<>(blocks.size());
        for (String b : blocks) {
            parsed.add(Block.of(decodeHex(b.replaceAll("\\s+", ""))));
        }
        return TagImage.of(parsed);
    }

    /**
     * Parses Proxmark3 text. Blank lines and lines starting with {@code #} are
     * skipped; the hex after the first ':' (or the whole line) is taken when it
     * holds exactly 16 bytes, anything else is ignored.
     */
    public static TagImage fromProxmark3(String text) {
        Objects.requireNonNull(text, "text");
        List<Block> parsed = new ArrayList<>(TagGeometry.BLOCK_COUNT);
        for (String raw : text.strip().split("\\R")) {
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            int colon = line.indexOf(':');
            String hexPart = colon >= 0 ? line.substring(colon + 1) : line;
            String clean = hexPart.replaceAll("\\s+", "");
            if (clean.length() == PROXMARK_HEX_CHARS) {
                parsed.add(Block.of(decodeHex(clean)));
            }
        }
        if (parsed.size() != TagGeometry.BLOCK_COUNT) {
            throw new MalformedImageException("expected " + TagGeometry.BLOCK_COUNT
                    + " blocks in Proxmark3 dump, found " + parsed.size());
        }
        return TagImage.of(parsed);
    }

    // ---------------------------------------------------------------------
    // Formatting
    // ---------------------------------------------------------------------

    public static byte[] toBinary(TagImage image) {
        return image.toBytes();
    }

    public static String toHex(TagImage image) {
        return Hex.toHexString(image.toBytes()).toUpperCase(Locale.ROOT);
    }

    public static String toBase64(TagImage image) {
        return Base64.getEncoder().encodeToString(image.toBytes());
    }

    public static List<String> toBase64Blocks(TagImage image) {
        List<String> out = new ArrayList<>(TagGeometry.BLOCK_COUNT);
        for (Block b : image.blocks()) {
            out.add(Base64.getEncoder().encodeToString(b.toBytes()));
        }
        return out;
    }

    public static List<String> toHexBlocks(TagImage image) {
        List<String> out = new ArrayList<>(TagGeometry.BLOCK_COUNT);
        for (Block b : image.blocks()) {
            out.add(b.toHex());
        }
        return out;
    }

    public static String toProxmark3(TagImage image) {
        StringBuilder sb = new StringBuilder();
        List<Block> blocks = image.blocks();
        for (int i = 0; i < blocks.size(); i++) {
            sb.append(String.format(Locale.ROOT, "Block %02d:", i));
            byte[] data = blocks.get(i).toBytes();
            for (byte v : data) {
                sb.append(String.format(Locale.ROOT, " %02X", v & 0xFF));
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Strict base64 block decode shared with the bridge envelope codec.
     *
     * @throws MalformedImageException on invalid base64
     */
    public static byte[] decodeBase64(String value) {
        Objects.requireNonNull(value, "value");
        try {
            return Base64.getDecoder().decode(value);
        } catch (IllegalArgumentException e) {
            throw new MalformedImageException("invalid base64: " + e.getMessage(), e);
        }
    }

    private static byte[] decodeHex(String hex) {
        if (hex.length() % 2 != 0) {
            throw new MalformedImageException("hex has odd length " + hex.length());
        }
        try {
            return Hex.decode(hex);
        } catch (DecoderException e) {
            throw new MalformedImageException("invalid hex: " + e.getMessage(), e);
        }
    }
}
