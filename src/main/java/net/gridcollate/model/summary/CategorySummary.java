package net.gridcollate.model.summary;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.ArrayList;
import java.util.List;

/**
 * Counters for one category, aggregated from its subcategories.
 */
@JsonPropertyOrder({"category", "imagesInFolder", "checked", "duplicatesFound", "processed",
    "stitchedBatches", "skippedReason", "subcategories"})
public class CategorySummary {

    private final String category;
    private final List<SubcategorySummary> subcategories = new ArrayList<>();
    private String skippedReason;

    public CategorySummary(String category) {
        this.category = category;
    }

    public SubcategorySummary addSubcategory(String label) {
        SubcategorySummary summary = new SubcategorySummary(label);
        subcategories.add(summary);
        return summary;
    }

    public void markSkipped(String reason) {
        this.skippedReason = reason;
    }

    public String getCategory() {
        return category;
    }

    public List<SubcategorySummary> getSubcategories() {
        return List.copyOf(subcategories);
    }

    public String getSkippedReason() {
        return skippedReason;
    }

    public int getImagesInFolder() {
        return subcategories.stream().mapToInt(SubcategorySummary::getImagesInFolder).sum();
    }

    public int getChecked() {
        return subcategories.stream().mapToInt(SubcategorySummary::getChecked).sum();
    }

    public int getDuplicatesFound() {
        return subcategories.stream().mapToInt(SubcategorySummary::getDuplicatesFound).sum();
    }

    public int getProcessed() {
        return subcategories.stream().mapToInt(SubcategorySummary::getProcessed).sum();
    }

    public int getStitchedBatches() {
        return subcategories.stream().mapToInt(SubcategorySummary::getStitchedBatches).sum();
    }
}
