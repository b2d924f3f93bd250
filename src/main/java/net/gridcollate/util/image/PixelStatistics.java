package net.gridcollate.util.image;

import java.awt.image.BufferedImage;

/**
 * Plain pixel-count features used to order images inside a grid.
 *
 * <p>A pixel is "white" when every channel is at or above the white threshold and
 * "black" when every channel is at or below the black threshold. Ratios are exact
 * counts over every pixel, so the same decode always yields the same value.</p>
 */
public final class PixelStatistics {

    /** Channel value at or above which a pixel counts as white. */
    public static final int DEFAULT_WHITE_THRESHOLD = 240;

    /** Channel value at or below which a pixel counts as black. */
    public static final int DEFAULT_BLACK_THRESHOLD = 30;

    /** Edge length of the thumbnail the dominant colour is averaged over. */
    public static final int DEFAULT_DOMINANT_COLOR_SAMPLE_SIZE = 50;

    private PixelStatistics() {
    }

    /**
     * Fraction of pixels whose red, green and blue channels are all {@code >= threshold}.
     *
     * @param image RGB image; {@code null} or empty returns {@code 0}
     * @param threshold inclusive channel threshold
     * @return ratio in [0, 1]
     */
    public static double whiteness(BufferedImage image, int threshold) {
        if (image == null || image.getWidth() == 0 || image.getHeight() == 0) {
            return 0.0;
        }
        int[] pixels = ImageScaling.rgbPixels(image);
        long white = 0;
        for (int rgb : pixels) {
            int r = (rgb >> 16) & 0xFF;
            int g = (rgb >> 8) & 0xFF;
            int b = rgb & 0xFF;
            if (r >= threshold && g >= threshold && b >= threshold) {
                white++;
            }
        }
        return (double) white / pixels.length;
    }

    /**
     * Fraction of pixels whose red, green and blue channels are all {@code <= threshold}.
     *
     * @param image RGB image; {@code null} or empty returns {@code 0}
     * @param threshold inclusive channel threshold
     * @return ratio in [0, 1]
     */
    public static double blackness(BufferedImage image, int threshold) {
        if (image == null || image.getWidth() == 0 || image.getHeight() == 0) {
            return 0.0;
        }
        int[] pixels = ImageScaling.rgbPixels(image);
        long black = 0;
        for (int rgb : pixels) {
            int r = (rgb >> 16) & 0xFF;
            int g = (rgb >> 8) & 0xFF;
            int b = rgb & 0xFF;
            if (r <= threshold && g <= threshold && b <= threshold) {
                black++;
            }
        }
        return (double) black / pixels.length;
    }

    /**
     * Mean colour of the image after shrinking it to a {@code sampleSize} square thumbnail.
     *
     * @param image RGB image
     * @param sampleSize thumbnail edge length; values {@code <= 0} average the full image
     * @return {@code [r, g, b]} means in 0..255
     */
    public static double[] dominantColor(BufferedImage image, int sampleSize) {
        if (image == null || image.getWidth() == 0 || image.getHeight() == 0) {
            return new double[] {0.0, 0.0, 0.0};
        }
        BufferedImage sample = sampleSize > 0
            ? ImageScaling.toRgb(image, sampleSize, sampleSize)
            : image;
        int[] pixels = ImageScaling.rgbPixels(sample);
        long sumR = 0;
        long sumG = 0;
        long sumB = 0;
        for (int rgb : pixels) {
            sumR += (rgb >> 16) & 0xFF;
            sumG += (rgb >> 8) & 0xFF;
            sumB += rgb & 0xFF;
        }
        double count = pixels.length;
        return new double[] {sumR / count, sumG / count, sumB / count};
    }
}
