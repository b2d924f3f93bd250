package net.gridcollate.model.image;

import jakarta.annotation.Nullable;
import java.nio.file.Path;

/**
 * One unit of discovery and grouping.
 *
 * <p>{@code name} is {@code null} for the implicit pool of images that sit directly in
 * the category directory. {@code label} is what appears in output names and ledger
 * rows; for the root pool it is the configured root label, never inferred from a
 * directory name.</p>
 *
 * @param category category directory name
 * @param name subdirectory name, or {@code null} for the root-of-category pool
 * @param label name used in output files and ledger rows
 * @param directory directory whose image files form this unit's pool
 */
public record SubcategoryRef(String category, @Nullable String name, String label, Path directory) {

    public static SubcategoryRef root(String category, String rootLabel, Path categoryDir) {
        return new SubcategoryRef(category, null, rootLabel, categoryDir);
    }

    public static SubcategoryRef named(String category, String name, Path directory) {
        return new SubcategoryRef(category, name, name, directory);
    }

    public boolean isRoot() {
        return name == null;
    }

    /** Deterministic output stem {@code category-label-batchNumber}. */
    public String outputStem(int batchNumber) {
        return category + "-" + label + "-" + batchNumber;
    }
}
