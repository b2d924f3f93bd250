package net.gridcollate.support.discovery;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import net.gridcollate.exception.InputTreeException;
import net.gridcollate.model.image.SubcategoryRef;
import org.springframework.stereotype.Component;

/**
 * Walks the {@code root/category/[subcategory/]image} layout.
 *
 * <p>Listings are sorted by name so every run visits units and files in the same order.</p>
 */
@Slf4j
@Component
public class ImageDirectoryScanner {

    static final Set<String> IMAGE_EXTENSIONS = Set.of("png", "jpg", "jpeg");

    /**
     * Category directories directly under {@code root}.
     *
     * @throws InputTreeException when the root is missing or cannot be listed
     */
    public List<Path> listCategories(Path root) {
        if (root == null || !Files.isDirectory(root)) {
            throw new InputTreeException(root, "directory does not exist", null);
        }
        try {
            return sortedDirectories(root);
        } catch (IOException e) {
            throw new InputTreeException(root, e.getMessage(), e);
        }
    }

    /**
     * Named subdirectories of a category followed by its implicit root pool.
     *
     * <p>The root pool's label is {@code rootLabel}. When a real subdirectory already
     * uses that name, the root pool becomes {@code rootLabel + "-root"}, then
     * {@code rootLabel + "-root-2"} and so on until the label is free, so outputs and
     * ledger rows of the root pool never collide with a named subcategory.</p>
     *
     * @throws IOException when the category directory cannot be listed
     */
    public List<SubcategoryRef> listSubcategories(Path categoryDir, String rootLabel) throws IOException {
        String category = categoryDir.getFileName().toString();
        List<SubcategoryRef> units = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (Path dir : sortedDirectories(categoryDir)) {
            String name = dir.getFileName().toString();
            names.add(name);
            units.add(SubcategoryRef.named(category, name, dir));
        }
        String effectiveRootLabel = freeLabel(rootLabel, names);
        if (!effectiveRootLabel.equals(rootLabel)) {
            log.warn("Category {} has a subdirectory named '{}'; root images are labelled '{}'.",
                category, rootLabel, effectiveRootLabel);
        }
        units.add(SubcategoryRef.root(category, effectiveRootLabel, categoryDir));
        return units;
    }

    static String freeLabel(String rootLabel, Set<String> taken) {
        if (!taken.contains(rootLabel)) {
            return rootLabel;
        }
        String candidate = rootLabel + "-root";
        for (int suffix = 2; taken.contains(candidate); suffix++) {
            candidate = rootLabel + "-root-" + suffix;
        }
        return candidate;
    }

    /**
     * Image files directly inside {@code dir}, sorted by file name.
     *
     * @throws IOException when the directory cannot be listed
     */
    public List<Path> listImages(Path dir) throws IOException {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries
                .filter(Files::isRegularFile)
                .filter(ImageDirectoryScanner::isImageFile)
                .sorted((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()))
                .toList();
        }
    }

    static boolean isImageFile(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return false;
        }
        return IMAGE_EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private static List<Path> sortedDirectories(Path parent) throws IOException {
        try (Stream<Path> entries = Files.list(parent)) {
            return entries
                .filter(Files::isDirectory)
                .sorted((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()))
                .toList();
        }
    }
}
