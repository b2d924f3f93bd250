package net.gridcollate.service.image;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import net.gridcollate.config.CollateProperties;
import net.gridcollate.exception.BatchRenderException;
import net.gridcollate.model.image.GridLayout;
import net.gridcollate.model.image.ImageRecord;
import net.gridcollate.model.image.RenderedBatch;
import net.gridcollate.model.image.SubcategoryRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Draws a full batch into one grid canvas and saves it.
 *
 * <p>Image {@code i} of the batch lands in cell {@code (i / cols, i % cols)}, filling
 * rows left to right and top to bottom. Only the coordinating thread renders, so
 * batch files appear in batch-number order.</p>
 */
@Service
public class GridCompositor {

    private static final Logger logger = LoggerFactory.getLogger(GridCompositor.class);

    private final ImageCodec imageCodec;
    private final SecondaryFormatExporter secondaryFormatExporter;
    private final CollateProperties properties;

    public GridCompositor(ImageCodec imageCodec,
                          SecondaryFormatExporter secondaryFormatExporter,
                          CollateProperties properties) {
        this.imageCodec = imageCodec;
        this.secondaryFormatExporter = secondaryFormatExporter;
        this.properties = properties;
    }

    /**
     * Lays out exactly {@code layout.capacity()} images on a new canvas.
     *
     * @throws IllegalArgumentException when the batch is not exactly one grid's worth or lacks pixels
     */
    public static BufferedImage compose(List<ImageRecord> batch, GridLayout layout) {
        if (batch.size() != layout.capacity()) {
            throw new IllegalArgumentException(
                "Batch holds " + batch.size() + " images; grid needs exactly " + layout.capacity());
        }
        BufferedImage canvas = new BufferedImage(layout.canvasWidth(), layout.canvasHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = canvas.createGraphics();
        try {
            for (int i = 0; i < batch.size(); i++) {
                ImageRecord record = batch.get(i);
                if (record.pixels() == null) {
                    throw new IllegalArgumentException("Image " + record.filename() + " has no decoded pixels");
                }
                int x = layout.colOf(i) * layout.cellWidth();
                int y = layout.rowOf(i) * layout.cellHeight();
                g.drawImage(record.pixels(), x, y, layout.cellWidth(), layout.cellHeight(), null);
            }
        } finally {
            g.dispose();
        }
        return canvas;
    }

    /**
     * Composes, saves the primary output and attempts the secondary export.
     * Pixels of every record in the batch are released afterwards, whatever the outcome.
     *
     * @throws BatchRenderException when the primary output cannot be written
     */
    public RenderedBatch render(SubcategoryRef subcategory, int batchNumber, List<ImageRecord> batch) {
        GridLayout layout = properties.gridLayout();
        String stem = subcategory.outputStem(batchNumber);
        Path primary = properties.getOutputDir().resolve(stem + "." + properties.getPrimaryFormat());
        try {
            BufferedImage canvas = compose(batch, layout);
            try {
                Files.createDirectories(properties.getOutputDir());
                imageCodec.encode(canvas, properties.getPrimaryFormat(), primary);
            } catch (IOException e) {
                throw new BatchRenderException(primary, e);
            }
            Path secondary = secondaryFormatExporter.export(canvas, primary);
            canvas.flush();
            logger.info("Batch {} stitched and saved as {}{}.", batchNumber, primary.getFileName(),
                secondary != null ? " and " + secondary.getFileName() : "");
            return new RenderedBatch(subcategory.category(), subcategory.label(), batchNumber, primary, secondary,
                batch.stream().map(ImageRecord::filename).toList());
        } finally {
            batch.forEach(ImageRecord::releasePixels);
        }
    }
}
