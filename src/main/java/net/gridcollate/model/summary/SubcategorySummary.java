package net.gridcollate.model.summary;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.ArrayList;
import java.util.List;

/**
 * Running counters for one subcategory.
 *
 * <p>Mutated only by the coordinating thread while the subcategory is processed.</p>
 */
@JsonPropertyOrder({"subcategory", "imagesInFolder", "checked", "duplicatesFound", "processed",
    "stitchedBatches", "failed", "duplicateFiles", "failedFiles", "skippedReason"})
public class SubcategorySummary {

    private final String subcategory;
    private int imagesInFolder;
    private int checked;
    private int processed;
    private int stitchedBatches;
    private final List<String> duplicateFiles = new ArrayList<>();
    private final List<String> failedFiles = new ArrayList<>();
    private String skippedReason;

    public SubcategorySummary(String subcategory) {
        this.subcategory = subcategory;
    }

    public void recordDiscovered(int count) {
        imagesInFolder += count;
    }

    public void recordChecked() {
        checked++;
    }

    public void recordDuplicate(String filename) {
        duplicateFiles.add(filename);
    }

    public void recordFailure(String filename) {
        failedFiles.add(filename);
    }

    public void recordBatch(int imagesInBatch) {
        stitchedBatches++;
        processed += imagesInBatch;
    }

    public void markSkipped(String reason) {
        this.skippedReason = reason;
    }

    public String getSubcategory() {
        return subcategory;
    }

    public int getImagesInFolder() {
        return imagesInFolder;
    }

    public int getChecked() {
        return checked;
    }

    public int getDuplicatesFound() {
        return duplicateFiles.size();
    }

    public int getProcessed() {
        return processed;
    }

    public int getStitchedBatches() {
        return stitchedBatches;
    }

    public int getFailed() {
        return failedFiles.size();
    }

    public List<String> getDuplicateFiles() {
        return List.copyOf(duplicateFiles);
    }

    public List<String> getFailedFiles() {
        return List.copyOf(failedFiles);
    }

    public String getSkippedReason() {
        return skippedReason;
    }
}
