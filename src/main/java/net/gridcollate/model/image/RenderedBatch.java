package net.gridcollate.model.image;

import jakarta.annotation.Nullable;
import java.nio.file.Path;
import java.util.List;

/**
 * A batch that was composited and saved.
 *
 * @param category category name
 * @param subcategory subcategory label
 * @param batchNumber batch number used in the output name
 * @param primaryOutput the saved grid image
 * @param secondaryOutput the secondary export, or {@code null} when disabled or failed
 * @param filenames images in grid order
 */
public record RenderedBatch(
        String category,
        String subcategory,
        int batchNumber,
        Path primaryOutput,
        @Nullable Path secondaryOutput,
        List<String> filenames) {

    public RenderedBatch {
        filenames = filenames == null ? List.of() : List.copyOf(filenames);
    }
}
