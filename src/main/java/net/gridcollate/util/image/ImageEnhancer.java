package net.gridcollate.util.image;

import java.awt.image.BufferedImage;

/**
 * Optional pre-processing applied before features are extracted: per-channel
 * autocontrast followed by a sharpness boost.
 */
public final class ImageEnhancer {

    /** Sharpness factor; 1.0 leaves the image unchanged. */
    public static final double DEFAULT_SHARPNESS = 1.5;

    // 3x3 smoothing kernel, centre weight 5, total 13
    private static final int SMOOTH_CENTER_WEIGHT = 5;
    private static final int SMOOTH_TOTAL_WEIGHT = 13;

    private ImageEnhancer() {
    }

    /**
     * Applies autocontrast then sharpening and returns a new RGB image.
     */
    public static BufferedImage enhance(BufferedImage image) {
        return sharpen(autocontrast(image), DEFAULT_SHARPNESS);
    }

    /**
     * Stretches each channel so its darkest value maps to 0 and its brightest to 255.
     * Channels with a single value are left unchanged.
     */
    public static BufferedImage autocontrast(BufferedImage image) {
        BufferedImage rgb = ImageScaling.toRgb(image);
        int[] pixels = ImageScaling.rgbPixels(rgb);
        int[] min = {255, 255, 255};
        int[] max = {0, 0, 0};
        for (int p : pixels) {
            for (int c = 0; c < 3; c++) {
                int v = channel(p, c);
                if (v < min[c]) {
                    min[c] = v;
                }
                if (v > max[c]) {
                    max[c] = v;
                }
            }
        }

        int[][] lut = new int[3][256];
        for (int c = 0; c < 3; c++) {
            int range = max[c] - min[c];
            for (int v = 0; v < 256; v++) {
                if (range <= 0) {
                    lut[c][v] = v;
                } else {
                    int stretched = (int) Math.round((v - min[c]) * 255.0 / range);
                    lut[c][v] = clamp(stretched);
                }
            }
        }

        int[] out = new int[pixels.length];
        for (int i = 0; i < pixels.length; i++) {
            int p = pixels[i];
            out[i] = pack(lut[0][channel(p, 0)], lut[1][channel(p, 1)], lut[2][channel(p, 2)]);
        }
        rgb.setRGB(0, 0, rgb.getWidth(), rgb.getHeight(), out, 0, rgb.getWidth());
        return rgb;
    }

    /**
     * Blends the image away from a smoothed copy of itself.
     * Border pixels are kept as-is.
     *
     * @param factor 1.0 returns an identical image; larger values sharpen
     */
    public static BufferedImage sharpen(BufferedImage image, double factor) {
        BufferedImage rgb = ImageScaling.toRgb(image);
        int width = rgb.getWidth();
        int height = rgb.getHeight();
        int[] src = ImageScaling.rgbPixels(rgb);
        if (width < 3 || height < 3) {
            return rgb;
        }
        int[] out = src.clone();
        for (int y = 1; y < height - 1; y++) {
            for (int x = 1; x < width - 1; x++) {
                int idx = y * width + x;
                int[] blended = new int[3];
                for (int c = 0; c < 3; c++) {
                    int sum = 0;
                    for (int dy = -1; dy <= 1; dy++) {
                        for (int dx = -1; dx <= 1; dx++) {
                            int weight = (dx == 0 && dy == 0) ? SMOOTH_CENTER_WEIGHT : 1;
                            sum += weight * channel(src[idx + dy * width + dx], c);
                        }
                    }
                    double smooth = (double) sum / SMOOTH_TOTAL_WEIGHT;
                    double original = channel(src[idx], c);
                    blended[c] = clamp((int) Math.round(smooth + factor * (original - smooth)));
                }
                out[idx] = pack(blended[0], blended[1], blended[2]);
            }
        }
        rgb.setRGB(0, 0, width, height, out, 0, width);
        return rgb;
    }

    private static int channel(int rgb, int c) {
        return switch (c) {
            case 0 -> (rgb >> 16) & 0xFF;
            case 1 -> (rgb >> 8) & 0xFF;
            default -> rgb & 0xFF;
        };
    }

    private static int pack(int r, int g, int b) {
        return (r << 16) | (g << 8) | b;
    }

    private static int clamp(int v) {
        return Math.max(0, Math.min(255, v));
    }
}
