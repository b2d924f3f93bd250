package net.gridcollate.exception;

import java.nio.file.Path;

/**
 * An image could not be decoded, resized or analysed.
 * RECOVERABLE: the file is excluded for this run and counted as checked only.
 */
public class FeatureExtractionException extends CollateException {

    private final transient Path imagePath;

    public FeatureExtractionException(Path imagePath, Throwable cause) {
        super("Failed to extract features from " + imagePath + ": " + cause.getMessage(), false, cause);
        this.imagePath = imagePath;
    }

    public Path getImagePath() {
        return imagePath;
    }
}
