/**
 * One candidate image with the features used for dedup, ordering and compositing.
 *
 * <p>Records are created by the feature extractor and consumed by the compositor,
 * which releases {@link #pixels()} once the batch has been drawn. They are never
 * persisted; only the fingerprint and filename reach the ledger.</p>
 *
 * @param filename file name within its subcategory directory
 * @param fingerprint perceptual fingerprint
 * @param dominantColor mean colour as {@code [r, g, b]} in 0..255
 * @param whiteness fraction of pixels with every channel at or above the white threshold
 * @param blackness fraction of pixels with every channel at or below the black threshold
 * @param pixels decoded image at working resolution; {@code null} in pure-feature tests
 */

package net.gridcollate.model.image;

import jakarta.annotation.Nullable;
import java.awt.image.BufferedImage;
import java.util.Arrays;

public record ImageRecord(
        String filename,
        Fingerprint fingerprint,
        double[] dominantColor,
        double whiteness,
        double blackness,
        @Nullable BufferedImage pixels) {

    /** Mid-gray reference point used for colourfulness. */
    public static final double NEUTRAL_GRAY = 128.0;

    public ImageRecord {
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("filename is required");
        }
        if (fingerprint == null) {
            throw new IllegalArgumentException("fingerprint is required for " + filename);
        }
        if (dominantColor == null || dominantColor.length != 3) {
            throw new IllegalArgumentException("dominantColor must have three components for " + filename);
        }
        dominantColor = Arrays.copyOf(dominantColor, 3);
    }

    @Override
    public double[] dominantColor() {
        return Arrays.copyOf(dominantColor, 3);
    }

    /**
     * Euclidean distance of the dominant colour from (128, 128, 128).
     * Larger values mean a more saturated or more extreme mean colour.
     */
    public double colorDistanceFromGray() {
        double dr = dominantColor[0] - NEUTRAL_GRAY;
        double dg = dominantColor[1] - NEUTRAL_GRAY;
        double db = dominantColor[2] - NEUTRAL_GRAY;
        return Math.sqrt(dr * dr + dg * dg + db * db);
    }

    /** Frees the decoded raster held by this record. */
    public void releasePixels() {
        if (pixels != null) {
            pixels.flush();
        }
    }
}
