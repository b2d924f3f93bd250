package net.gridcollate.model.image;

import java.util.HexFormat;

/**
 * 64-bit perceptual fingerprint of an image.
 *
 * <p>The canonical string form is 16 lowercase hex digits, most significant bit
 * first. That form is what the ledger stores, so it must stay stable.</p>
 *
 * @param bits the packed hash bits
 */
public record Fingerprint(long bits) implements Comparable<Fingerprint> {

    public static final int BIT_LENGTH = Long.SIZE;
    private static final int HEX_LENGTH = BIT_LENGTH / 4;

    /**
     * Parses the canonical hex form.
     *
     * @param hex 16 hex digits, case-insensitive
     * @return the fingerprint
     * @throws IllegalArgumentException when the value is not 16 hex digits
     */
    public static Fingerprint fromHex(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("Fingerprint hex must not be null");
        }
        String trimmed = hex.trim();
        if (trimmed.length() != HEX_LENGTH) {
            throw new IllegalArgumentException("Fingerprint hex must be " + HEX_LENGTH + " digits: '" + hex + "'");
        }
        try {
            return new Fingerprint(HexFormat.fromHexDigitsToLong(trimmed));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Fingerprint hex is malformed: '" + hex + "'", ex);
        }
    }

    public String toHex() {
        return HexFormat.of().toHexDigits(bits);
    }

    /** Number of differing bits between two fingerprints. */
    public int hammingDistance(Fingerprint other) {
        return Long.bitCount(bits ^ other.bits);
    }

    @Override
    public int compareTo(Fingerprint other) {
        return Long.compareUnsigned(bits, other.bits);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
