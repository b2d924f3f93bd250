package net.gridcollate.config;

import jakarta.annotation.PostConstruct;
import java.nio.file.Path;
import java.util.Locale;
import net.gridcollate.model.image.GridLayout;
import net.gridcollate.util.image.PixelStatistics;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

/**
 * Strongly typed configuration for a collation run.
 */
@Component
@ConfigurationProperties(prefix = "collate")
public class CollateProperties {

    static final String DEFAULT_LEDGER_FILE_NAME = "stitched_images_log.csv";

    /**
     * Root directory holding one directory per category.
     */
    private Path inputDir = Path.of("input");

    /**
     * Directory the grid images are written to.
     */
    private Path outputDir = Path.of("output");

    /**
     * Ledger CSV; defaults to {@value #DEFAULT_LEDGER_FILE_NAME} inside the output directory.
     */
    private Path ledgerFile;

    private int gridRows = 4;

    private int gridCols = 4;

    /**
     * Working-resolution width every image is resized to.
     */
    private int cellWidth = 512;

    /**
     * Working-resolution height every image is resized to.
     */
    private int cellHeight = 512;

    private int whiteThreshold = PixelStatistics.DEFAULT_WHITE_THRESHOLD;

    private int blackThreshold = PixelStatistics.DEFAULT_BLACK_THRESHOLD;

    private int dominantColorSampleSize = PixelStatistics.DEFAULT_DOMINANT_COLOR_SAMPLE_SIZE;

    /**
     * Feature-extraction worker count; 0 uses the host's available processors.
     */
    private int workerThreads = 0;

    /**
     * Capacity of the bounded queue in front of the extraction workers.
     */
    private int workQueueCapacity = 256;

    /**
     * ImageIO format name of the primary grid output.
     */
    private String primaryFormat = "png";

    /**
     * ImageIO format name of the optional secondary export; blank disables it.
     */
    private String secondaryFormat = "";

    /**
     * Apply autocontrast and sharpening before extracting features.
     */
    private boolean preprocess = false;

    /**
     * Label used for images that sit directly in a category directory.
     */
    private String rootSubcategoryLabel = "main";

    /**
     * Optional JSON file the run summary is written to.
     */
    private Path summaryReport;

    /**
     * Whether the command-line runner starts a run when the application boots.
     */
    private boolean runOnStartup = true;

    @PostConstruct
    void validate() {
        Assert.isTrue(gridRows > 0, "collate.grid-rows must be positive");
        Assert.isTrue(gridCols > 0, "collate.grid-cols must be positive");
        Assert.isTrue(cellWidth > 0, "collate.cell-width must be positive");
        Assert.isTrue(cellHeight > 0, "collate.cell-height must be positive");
        Assert.isTrue(whiteThreshold >= 0 && whiteThreshold <= 255, "collate.white-threshold must be within 0..255");
        Assert.isTrue(blackThreshold >= 0 && blackThreshold <= 255, "collate.black-threshold must be within 0..255");
        Assert.isTrue(workerThreads >= 0, "collate.worker-threads must be non-negative");
        Assert.isTrue(workQueueCapacity > 0, "collate.work-queue-capacity must be positive");
        Assert.hasText(primaryFormat, "collate.primary-format is required");
        Assert.hasText(rootSubcategoryLabel, "collate.root-subcategory-label is required");
    }

    public GridLayout gridLayout() {
        return new GridLayout(gridRows, gridCols, cellWidth, cellHeight);
    }

    public Path resolveLedgerFile() {
        return ledgerFile != null ? ledgerFile : outputDir.resolve(DEFAULT_LEDGER_FILE_NAME);
    }

    public int resolveWorkerThreads() {
        return workerThreads > 0 ? workerThreads : Runtime.getRuntime().availableProcessors();
    }

    public boolean isSecondaryExportEnabled() {
        return StringUtils.hasText(secondaryFormat);
    }

    public Path getInputDir() {
        return inputDir;
    }

    public void setInputDir(Path inputDir) {
        this.inputDir = inputDir;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(Path outputDir) {
        this.outputDir = outputDir;
    }

    public Path getLedgerFile() {
        return ledgerFile;
    }

    public void setLedgerFile(Path ledgerFile) {
        this.ledgerFile = ledgerFile;
    }

    public int getGridRows() {
        return gridRows;
    }

    public void setGridRows(int gridRows) {
        this.gridRows = gridRows;
    }

    public int getGridCols() {
        return gridCols;
    }

    public void setGridCols(int gridCols) {
        this.gridCols = gridCols;
    }

    public int getCellWidth() {
        return cellWidth;
    }

    public void setCellWidth(int cellWidth) {
        this.cellWidth = cellWidth;
    }

    public int getCellHeight() {
        return cellHeight;
    }

    public void setCellHeight(int cellHeight) {
        this.cellHeight = cellHeight;
    }

    public int getWhiteThreshold() {
        return whiteThreshold;
    }

    public void setWhiteThreshold(int whiteThreshold) {
        this.whiteThreshold = whiteThreshold;
    }

    public int getBlackThreshold() {
        return blackThreshold;
    }

    public void setBlackThreshold(int blackThreshold) {
        this.blackThreshold = blackThreshold;
    }

    public int getDominantColorSampleSize() {
        return dominantColorSampleSize;
    }

    public void setDominantColorSampleSize(int dominantColorSampleSize) {
        this.dominantColorSampleSize = dominantColorSampleSize;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public int getWorkQueueCapacity() {
        return workQueueCapacity;
    }

    public void setWorkQueueCapacity(int workQueueCapacity) {
        this.workQueueCapacity = workQueueCapacity;
    }

    public String getPrimaryFormat() {
        return primaryFormat;
    }

    public void setPrimaryFormat(String primaryFormat) {
        this.primaryFormat = primaryFormat != null ? primaryFormat.trim().toLowerCase(Locale.ROOT) : "png";
    }

    public String getSecondaryFormat() {
        return secondaryFormat;
    }

    public void setSecondaryFormat(String secondaryFormat) {
        this.secondaryFormat = secondaryFormat != null ? secondaryFormat.trim().toLowerCase(Locale.ROOT) : "";
    }

    public boolean isPreprocess() {
        return preprocess;
    }

    public void setPreprocess(boolean preprocess) {
        this.preprocess = preprocess;
    }

    public String getRootSubcategoryLabel() {
        return rootSubcategoryLabel;
    }

    public void setRootSubcategoryLabel(String rootSubcategoryLabel) {
        this.rootSubcategoryLabel = rootSubcategoryLabel;
    }

    public Path getSummaryReport() {
        return summaryReport;
    }

    public void setSummaryReport(Path summaryReport) {
        this.summaryReport = summaryReport;
    }

    public boolean isRunOnStartup() {
        return runOnStartup;
    }

    public void setRunOnStartup(boolean runOnStartup) {
        this.runOnStartup = runOnStartup;
    }
}
