package net.gridcollate.service.collate;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import net.gridcollate.config.CollateProperties;
import net.gridcollate.model.image.ExtractionResult;
import net.gridcollate.model.image.ImageRecord;
import net.gridcollate.model.image.RenderedBatch;
import net.gridcollate.model.image.SubcategoryRef;
import net.gridcollate.model.ledger.LedgerEntry;
import net.gridcollate.model.summary.SubcategorySummary;
import net.gridcollate.service.image.FeatureExtractor;
import net.gridcollate.service.image.GridCompositor;
import net.gridcollate.service.ledger.DuplicateLedger;
import net.gridcollate.support.discovery.ImageDirectoryScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Processes one subcategory: discover its files, extract features in cycles, and
 * render a grid each time a full pool of non-duplicate candidates is collected.
 *
 * <p>Each extraction cycle dispatches only as many files as the pool still needs and
 * waits for all of them, so the pool never exceeds one grid and which files fill it
 * is decided by listing order, not worker completion order. Rendering and ledger
 * appends happen here on the calling thread.</p>
 *
 * <p>When the file list runs out with a partial pool, nothing is rendered and nothing
 * is written to the ledger for those images; they are picked up again next run.</p>
 */
@Service
public class SubcategoryCollator {

    private static final Logger log = LoggerFactory.getLogger(SubcategoryCollator.class);

    private final ImageDirectoryScanner scanner;
    private final FeatureExtractor featureExtractor;
    private final BatchGrouper batchGrouper;
    private final GridCompositor gridCompositor;
    private final CollateProperties properties;
    private final Executor extractionExecutor;

    public SubcategoryCollator(ImageDirectoryScanner scanner,
                               FeatureExtractor featureExtractor,
                               BatchGrouper batchGrouper,
                               GridCompositor gridCompositor,
                               CollateProperties properties,
                               @Qualifier("featureExtractionExecutor") Executor extractionExecutor) {
        this.scanner = scanner;
        this.featureExtractor = featureExtractor;
        this.batchGrouper = batchGrouper;
        this.gridCompositor = gridCompositor;
        this.properties = properties;
        this.extractionExecutor = extractionExecutor;
    }

    /**
     * Runs the full discover/extract/render loop for {@code subcategory}.
     *
     * @return batches rendered, in save order
     * @throws net.gridcollate.exception.LedgerException when a rendered batch cannot be recorded
     */
    public List<RenderedBatch> collate(SubcategoryRef subcategory, DuplicateLedger ledger, SubcategorySummary summary) {
        List<Path> files;
        try {
            files = scanner.listImages(subcategory.directory());
        } catch (IOException e) {
            log.warn("Skipping {}/{}: cannot list {} ({}).",
                subcategory.category(), subcategory.label(), subcategory.directory(), e.getMessage());
            summary.markSkipped("unreadable directory: " + e.getMessage());
            return List.of();
        }
        if (files.isEmpty()) {
            log.warn("No images found in {}/{} folder. Skipping.", subcategory.category(), subcategory.label());
            return List.of();
        }
        summary.recordDiscovered(files.size());
        if (subcategory.isRoot()) {
            log.info("Processing images directly from {} folder under '{}' subcategory.",
                subcategory.category(), subcategory.label());
        }

        int capacity = properties.gridLayout().capacity();
        int batchNumber = 1;
        Deque<Path> remaining = new ArrayDeque<>(files);
        List<ImageRecord> pool = new ArrayList<>(capacity);
        List<RenderedBatch> rendered = new ArrayList<>();

        while (!remaining.isEmpty()) {
            log.info("Checking for duplicates and loading images in {}...", subcategory.directory());
            while (pool.size() < capacity && !remaining.isEmpty()) {
                List<Path> wave = drainUpTo(remaining, capacity - pool.size());
                for (ExtractionResult result : extractAll(wave, ledger)) {
                    summary.recordChecked();
                    switch (result.status()) {
                        case CANDIDATE -> pool.add(result.record());
                        case DUPLICATE -> summary.recordDuplicate(result.filename());
                        case FAILED -> summary.recordFailure(result.filename());
                    }
                }
            }

            if (pool.size() < capacity) {
                log.warn("Not enough images for a full batch in {}/{}. Skipping batch {}. Remaining: {}",
                    subcategory.category(), subcategory.label(), batchNumber, pool.size());
                break;
            }

            BatchGrouper.Grouping grouping = batchGrouper.group(pool, capacity);
            pool = new ArrayList<>(grouping.remainder());
            for (List<ImageRecord> batch : grouping.batches()) {
                log.info("Stitching batch {} for {}/{}...", batchNumber, subcategory.category(), subcategory.label());
                RenderedBatch result;
                try {
                    result = gridCompositor.render(subcategory, batchNumber, batch);
                } catch (RuntimeException e) {
                    // BatchRenderException, or a writer failing outside the IOException path
                    abandon(subcategory, batchNumber, batch, ledger, summary, e);
                    releaseAll(pool);
                    return rendered;
                }
                ledger.append(toLedgerEntries(subcategory, batchNumber, batch));
                summary.recordBatch(batch.size());
                rendered.add(result);
                batchNumber++;
            }
        }

        releaseAll(pool);
        return rendered;
    }

    private static void abandon(SubcategoryRef subcategory, int batchNumber, List<ImageRecord> batch,
                                DuplicateLedger ledger, SubcategorySummary summary, RuntimeException cause) {
        log.error("Abandoning {}/{} after batch {} failed to render: {}",
            subcategory.category(), subcategory.label(), batchNumber, cause.getMessage(), cause);
        ledger.release(batch.stream().map(ImageRecord::fingerprint).toList());
        summary.markSkipped("render failed for batch " + batchNumber + ": " + cause.getMessage());
    }

    private List<ExtractionResult> extractAll(List<Path> wave, DuplicateLedger ledger) {
        List<CompletableFuture<ExtractionResult>> futures = new ArrayList<>(wave.size());
        for (Path file : wave) {
            futures.add(CompletableFuture.supplyAsync(() -> featureExtractor.extract(file, ledger), extractionExecutor));
        }
        List<ExtractionResult> results = new ArrayList<>(wave.size());
        for (int i = 0; i < futures.size(); i++) {
            String filename = wave.get(i).getFileName().toString();
            try {
                results.add(futures.get(i).join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Error processing {}: {}", filename, cause.getMessage(), cause);
                results.add(ExtractionResult.failed(filename, String.valueOf(cause.getMessage())));
            }
        }
        return results;
    }

    private static List<Path> drainUpTo(Deque<Path> remaining, int count) {
        List<Path> wave = new ArrayList<>(count);
        while (wave.size() < count && !remaining.isEmpty()) {
            wave.add(remaining.pollFirst());
        }
        return wave;
    }

    private static List<LedgerEntry> toLedgerEntries(SubcategoryRef subcategory, int batchNumber, List<ImageRecord> batch) {
        return batch.stream()
            .map(record -> new LedgerEntry(subcategory.category(), subcategory.label(), batchNumber,
                record.fingerprint(), record.filename()))
            .toList();
    }

    private static void releaseAll(List<ImageRecord> records) {
        records.forEach(ImageRecord::releasePixels);
    }
}
