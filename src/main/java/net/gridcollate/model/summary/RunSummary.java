package net.gridcollate.model.summary;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.ArrayList;
import java.util.List;

/**
 * Structured report for one run: per-category counters plus run-wide totals.
 */
@JsonPropertyOrder({"totalChecked", "totalDuplicates", "totalProcessed", "totalStitchedBatches",
    "ledgerPossiblyIncomplete", "abortReason", "categories"})
public class RunSummary {

    private final List<CategorySummary> categories = new ArrayList<>();
    private boolean ledgerPossiblyIncomplete;
    private String abortReason;

    public CategorySummary addCategory(String category) {
        CategorySummary summary = new CategorySummary(category);
        categories.add(summary);
        return summary;
    }

    /** Records that the run stopped before finishing all processable work. */
    public void abort(String reason, boolean ledgerIncomplete) {
        this.abortReason = reason;
        this.ledgerPossiblyIncomplete = this.ledgerPossiblyIncomplete || ledgerIncomplete;
    }

    public boolean isAborted() {
        return abortReason != null;
    }

    public List<CategorySummary> getCategories() {
        return List.copyOf(categories);
    }

    public boolean isLedgerPossiblyIncomplete() {
        return ledgerPossiblyIncomplete;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String getAbortReason() {
        return abortReason;
    }

    public int getTotalChecked() {
        return categories.stream().mapToInt(CategorySummary::getChecked).sum();
    }

    public int getTotalDuplicates() {
        return categories.stream().mapToInt(CategorySummary::getDuplicatesFound).sum();
    }

    public int getTotalProcessed() {
        return categories.stream().mapToInt(CategorySummary::getProcessed).sum();
    }

    public int getTotalStitchedBatches() {
        return categories.stream().mapToInt(CategorySummary::getStitchedBatches).sum();
    }
}
