package net.gridcollate.service.collate;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import net.gridcollate.config.CollateProperties;
import net.gridcollate.exception.CollateException;
import net.gridcollate.exception.InputTreeException;
import net.gridcollate.exception.LedgerException;
import net.gridcollate.model.image.SubcategoryRef;
import net.gridcollate.model.summary.CategorySummary;
import net.gridcollate.model.summary.RunSummary;
import net.gridcollate.model.summary.SubcategorySummary;
import net.gridcollate.service.ledger.DuplicateLedger;
import net.gridcollate.service.ledger.LedgerCsvStore;
import net.gridcollate.support.discovery.ImageDirectoryScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one collation pass over every category present under the input root.
 *
 * <p>Per-image and per-unit failures are absorbed into the summary. Only a ledger
 * failure or an unusable input root stops the run; the returned summary then carries
 * the abort reason, and {@code ledgerPossiblyIncomplete} when batches were already
 * rendered without their rows being recorded.</p>
 */
@Service
public class CollationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(CollationOrchestrator.class);

    private final CollateProperties properties;
    private final ImageDirectoryScanner scanner;
    private final SubcategoryCollator subcategoryCollator;

    public CollationOrchestrator(CollateProperties properties,
                                 ImageDirectoryScanner scanner,
                                 SubcategoryCollator subcategoryCollator) {
        this.properties = properties;
        this.scanner = scanner;
        this.subcategoryCollator = subcategoryCollator;
    }

    public RunSummary run() {
        RunSummary summary = new RunSummary();
        Path ledgerFile = properties.resolveLedgerFile();

        DuplicateLedger ledger;
        try {
            ledger = DuplicateLedger.load(new LedgerCsvStore(ledgerFile));
        } catch (LedgerException e) {
            log.error("Cannot load ledger; aborting before any rendering: {}", e.getMessage(), e);
            summary.abort(e.getMessage(), false);
            return summary;
        }

        List<Path> categories;
        try {
            categories = scanner.listCategories(properties.getInputDir());
        } catch (InputTreeException e) {
            log.error("Cannot start run: {}", e.getMessage(), e);
            summary.abort(e.getMessage(), false);
            return summary;
        }
        log.info("Collating {} categor{} from {} into {} ({}x{} grid, {}x{} cells).",
            categories.size(), categories.size() == 1 ? "y" : "ies",
            properties.getInputDir(), properties.getOutputDir(),
            properties.getGridRows(), properties.getGridCols(),
            properties.getCellWidth(), properties.getCellHeight());

        for (Path categoryDir : categories) {
            CategorySummary categorySummary = summary.addCategory(categoryDir.getFileName().toString());
            try {
                processCategory(categoryDir, categorySummary, ledger);
            } catch (LedgerException e) {
                log.error("Ledger append failed; stopping run. Rendered batches remain on disk but "
                    + "the ledger at {} may be incomplete: {}", e.getLedgerFile(), e.getMessage(), e);
                summary.abort(e.getMessage(), true);
                return summary;
            }
        }
        return summary;
    }

    private void processCategory(Path categoryDir, CategorySummary categorySummary, DuplicateLedger ledger) {
        List<SubcategoryRef> subcategories;
        try {
            subcategories = scanner.listSubcategories(categoryDir, properties.getRootSubcategoryLabel());
        } catch (IOException | UncheckedIOException e) {
            log.warn("Skipping {} because the category directory cannot be read: {}", categoryDir, e.getMessage());
            categorySummary.markSkipped("unreadable directory: " + e.getMessage());
            return;
        }

        for (SubcategoryRef subcategory : subcategories) {
            SubcategorySummary subcategorySummary = categorySummary.addSubcategory(subcategory.label());
            try {
                subcategoryCollator.collate(subcategory, ledger, subcategorySummary);
            } catch (RuntimeException e) {
                if (e instanceof CollateException collateException && collateException.isFatal()) {
                    throw e;
                }
                log.error("Skipping {}/{} after unexpected failure: {}",
                    subcategory.category(), subcategory.label(), e.getMessage(), e);
                subcategorySummary.markSkipped("unexpected failure: " + e.getMessage());
            }
        }
    }
}
