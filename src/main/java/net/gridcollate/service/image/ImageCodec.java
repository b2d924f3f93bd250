package net.gridcollate.service.image;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Decode and encode capability for raster files.
 */
public interface ImageCodec {

    /**
     * Decodes a file into an image.
     *
     * @throws IOException when the file cannot be read or is not a supported image
     */
    BufferedImage decode(Path file) throws IOException;

    /**
     * Encodes {@code image} in {@code format} to {@code target}, replacing any existing file.
     *
     * @throws IOException when no writer exists for the format or the write fails
     */
    void encode(BufferedImage image, String format, Path target) throws IOException;

    /** Whether a writer is registered for {@code format}. */
    boolean canEncode(String format);
}
