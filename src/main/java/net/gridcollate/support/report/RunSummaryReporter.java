package net.gridcollate.support.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import net.gridcollate.config.CollateProperties;
import net.gridcollate.model.summary.CategorySummary;
import net.gridcollate.model.summary.RunSummary;
import net.gridcollate.model.summary.SubcategorySummary;
import org.springframework.stereotype.Component;

/**
 * Logs the end-of-run report and, when {@code collate.summary-report} is set, writes it as JSON.
 */
@Slf4j
@Component
public class RunSummaryReporter {

    private static final String RULE = "=".repeat(40);

    private final ObjectMapper objectMapper;
    private final CollateProperties properties;

    public RunSummaryReporter(ObjectMapper objectMapper, CollateProperties properties) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.properties = properties;
    }

    public void report(RunSummary summary) {
        log.info("Summary Report");
        log.info(RULE);
        for (CategorySummary category : summary.getCategories()) {
            log.info("Category: {}{}", category.getCategory(),
                category.getSkippedReason() != null ? " (skipped: " + category.getSkippedReason() + ")" : "");
            for (SubcategorySummary sub : category.getSubcategories()) {
                log.info("  Subcategory: {}{}", sub.getSubcategory(),
                    sub.getSkippedReason() != null ? " (stopped: " + sub.getSkippedReason() + ")" : "");
                log.info("    Images in folder: {}", sub.getImagesInFolder());
                log.info("    Checked: {}", sub.getChecked());
                log.info("    Duplicates found: {}", sub.getDuplicatesFound());
                log.info("    Processed: {}", sub.getProcessed());
                log.info("    Stitched batches: {}", sub.getStitchedBatches());
                if (!sub.getDuplicateFiles().isEmpty()) {
                    log.info("    Duplicate files: {}", String.join(", ", sub.getDuplicateFiles()));
                }
                if (!sub.getFailedFiles().isEmpty()) {
                    log.info("    Failed files: {}", String.join(", ", sub.getFailedFiles()));
                }
            }
        }

        log.info("Overall Summary");
        log.info(RULE);
        log.info("Total images checked: {}", summary.getTotalChecked());
        log.info("Total duplicates found: {}", summary.getTotalDuplicates());
        log.info("Total images processed: {}", summary.getTotalProcessed());
        log.info("Total stitched batches: {}", summary.getTotalStitchedBatches());
        if (summary.isAborted()) {
            log.error("Run aborted: {}", summary.getAbortReason());
        }
        if (summary.isLedgerPossiblyIncomplete()) {
            log.error("Ledger may be missing rows for batches already written to {}.", properties.getOutputDir());
        }
        log.info(RULE);

        Path reportFile = properties.getSummaryReport();
        if (reportFile != null) {
            writeJson(summary, reportFile);
        }
    }

    void writeJson(RunSummary summary, Path reportFile) {
        try {
            Path parent = reportFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(reportFile.toFile(), summary);
            log.info("Summary report written to {}", reportFile);
        } catch (IOException e) {
            log.warn("Could not write summary report to {}: {}", reportFile, e.getMessage(), e);
        }
    }
}
