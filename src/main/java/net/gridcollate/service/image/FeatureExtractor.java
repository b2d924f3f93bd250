package net.gridcollate.service.image;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import net.gridcollate.config.CollateProperties;
import net.gridcollate.exception.FeatureExtractionException;
import net.gridcollate.model.image.ExtractionResult;
import net.gridcollate.model.image.Fingerprint;
import net.gridcollate.model.image.ImageRecord;
import net.gridcollate.service.ledger.DuplicateLedger;
import net.gridcollate.util.image.ImageEnhancer;
import net.gridcollate.util.image.ImageScaling;
import net.gridcollate.util.image.PixelStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns one image file into an {@link ImageRecord}.
 *
 * Processing steps:
 * - Decodes the file through the {@link ImageCodec}
 * - Resizes to the working resolution as packed RGB
 * - Optionally applies autocontrast and sharpening
 * - Computes dominant colour, whiteness, blackness and the perceptual fingerprint
 *
 * <p>Runs on extraction worker threads. The only shared state it touches is the
 * {@link DuplicateLedger}'s index through {@link DuplicateLedger#checkAndMark(Fingerprint)}.</p>
 */
@Service
public class FeatureExtractor {

    private static final Logger logger = LoggerFactory.getLogger(FeatureExtractor.class);

    private final ImageCodec imageCodec;
    private final PerceptualHasher perceptualHasher;
    private final CollateProperties properties;

    public FeatureExtractor(ImageCodec imageCodec, PerceptualHasher perceptualHasher, CollateProperties properties) {
        this.imageCodec = imageCodec;
        this.perceptualHasher = perceptualHasher;
        this.properties = properties;
    }

    /**
     * Extracts features and consults the ledger. Never throws for a bad image;
     * failures come back as {@link net.gridcollate.model.image.ExtractionStatus#FAILED}.
     *
     * @param file image file to process
     * @param ledger shared duplicate ledger for this run
     * @return candidate, duplicate or failure
     */
    public ExtractionResult extract(Path file, DuplicateLedger ledger) {
        String filename = file.getFileName().toString();
        ImageRecord record;
        try {
            record = analyze(file);
        } catch (FeatureExtractionException e) {
            logger.error("Error processing {}: {}", filename, e.getMessage());
            return ExtractionResult.failed(filename, e.getMessage());
        }

        if (ledger.checkAndMark(record.fingerprint())) {
            logger.warn("Duplicate image found: {} (fingerprint {}, {}). It will be ignored.", filename, record.fingerprint(),
                ledger.batchOf(record.fingerprint()).map(batch -> "ledgered in batch " + batch).orElse("seen earlier this run"));
            record.releasePixels();
            return ExtractionResult.duplicate(filename, record.fingerprint());
        }
        return ExtractionResult.candidate(record);
    }

    /**
     * Computes the feature fields for one file without touching the ledger.
     *
     * @throws FeatureExtractionException when the file cannot be decoded or analysed
     */
    public ImageRecord analyze(Path file) {
        BufferedImage decoded;
        try {
            decoded = imageCodec.decode(file);
        } catch (IOException e) {
            throw new FeatureExtractionException(file, e);
        }

        try {
            BufferedImage working = ImageScaling.toRgb(decoded, properties.getCellWidth(), properties.getCellHeight());
            decoded.flush();
            if (properties.isPreprocess()) {
                working = ImageEnhancer.enhance(working);
            }

            double[] dominantColor = PixelStatistics.dominantColor(working, properties.getDominantColorSampleSize());
            double whiteness = PixelStatistics.whiteness(working, properties.getWhiteThreshold());
            double blackness = PixelStatistics.blackness(working, properties.getBlackThreshold());
            Fingerprint fingerprint = perceptualHasher.hash(working);

            if (logger.isDebugEnabled()) {
                logger.debug("{}: fingerprint={}, dominant=({}, {}, {}), whiteness={}, blackness={}",
                    file.getFileName(), fingerprint,
                    String.format("%.1f", dominantColor[0]), String.format("%.1f", dominantColor[1]),
                    String.format("%.1f", dominantColor[2]),
                    String.format("%.4f", whiteness), String.format("%.4f", blackness));
            }
            return new ImageRecord(file.getFileName().toString(), fingerprint, dominantColor, whiteness, blackness, working);
        } catch (RuntimeException e) {
            throw new FeatureExtractionException(file, e);
        }
    }
}
