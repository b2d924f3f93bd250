package net.gridcollate.util.image;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Normalises decoded images to packed RGB and the working resolution.
 */
public final class ImageScaling {

    private ImageScaling() {
    }

    /**
     * Redraws {@code source} into a {@code TYPE_INT_RGB} raster of the given size.
     * Alpha is composited onto black, matching how an RGB conversion drops the channel.
     *
     * @param source decoded image of any type
     * @param width target width in pixels
     * @param height target height in pixels
     * @return a new RGB image; never {@code source} itself
     */
    public static BufferedImage toRgb(BufferedImage source, int width, int height) {
        if (source == null) {
            throw new IllegalArgumentException("source image is required");
        }
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Target size must be positive: " + width + "x" + height);
        }
        BufferedImage target = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = target.createGraphics();
        try {
            if (width != source.getWidth() || height != source.getHeight()) {
                g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
                g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            }
            g.drawImage(source, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return target;
    }

    /** Converts to packed RGB without changing dimensions. */
    public static BufferedImage toRgb(BufferedImage source) {
        return toRgb(source, source.getWidth(), source.getHeight());
    }

    /** Returns a row-major copy of the image's packed RGB pixels. */
    static int[] rgbPixels(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        return image.getRGB(0, 0, width, height, null, 0, width);
    }
}
