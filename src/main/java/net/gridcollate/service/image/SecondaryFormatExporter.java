package net.gridcollate.service.image;

import java.awt.image.BufferedImage;
import java.nio.file.Path;

/**
 * Best-effort export of a rendered grid to a secondary (texture) format.
 * Implementations report failure through the return value and never throw.
 */
public interface SecondaryFormatExporter {

    /**
     * Writes {@code canvas} next to {@code primaryOutput} with the same stem.
     *
     * @return the written file, or {@code null} when the export is disabled or failed
     */
    Path export(BufferedImage canvas, Path primaryOutput);
}
