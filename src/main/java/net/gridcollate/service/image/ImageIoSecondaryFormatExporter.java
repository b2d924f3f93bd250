package net.gridcollate.service.image;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import net.gridcollate.config.CollateProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Secondary export through whatever ImageIO writer is registered for
 * {@code collate.secondary-format}. A missing writer or a failed write is logged
 * and leaves the primary output and ledger untouched.
 */
@Component
public class ImageIoSecondaryFormatExporter implements SecondaryFormatExporter {

    private static final Logger logger = LoggerFactory.getLogger(ImageIoSecondaryFormatExporter.class);

    private final ImageCodec imageCodec;
    private final CollateProperties properties;

    public ImageIoSecondaryFormatExporter(ImageCodec imageCodec, CollateProperties properties) {
        this.imageCodec = imageCodec;
        this.properties = properties;
    }

    @Override
    public Path export(BufferedImage canvas, Path primaryOutput) {
        if (!properties.isSecondaryExportEnabled()) {
            return null;
        }
        String format = properties.getSecondaryFormat();
        Path target = siblingWithExtension(primaryOutput, format);
        if (!imageCodec.canEncode(format)) {
            logger.error("Error converting {} to {}: no writer registered for format '{}'.", primaryOutput, target, format);
            return null;
        }
        try {
            imageCodec.encode(canvas, format, target);
            logger.info("Converted {} to {}", primaryOutput, target);
            return target;
        } catch (IOException | RuntimeException e) {
            logger.error("Error converting {} to {}: {}", primaryOutput, target, e.getMessage(), e);
            return null;
        }
    }

    static Path siblingWithExtension(Path primaryOutput, String extension) {
        String name = primaryOutput.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return primaryOutput.resolveSibling(stem + "." + extension);
    }
}
