package net.gridcollate.model.image;

import jakarta.annotation.Nullable;

/**
 * Result of processing one file through the feature extractor.
 *
 * @param filename the file that was processed
 * @param status what happened to it
 * @param record the candidate, present only for {@link ExtractionStatus#CANDIDATE}
 * @param fingerprint fingerprint when one was computed (candidates and duplicates)
 * @param error failure detail for {@link ExtractionStatus#FAILED}
 */
public record ExtractionResult(
        String filename,
        ExtractionStatus status,
        @Nullable ImageRecord record,
        @Nullable Fingerprint fingerprint,
        @Nullable String error) {

    public static ExtractionResult candidate(ImageRecord record) {
        return new ExtractionResult(record.filename(), ExtractionStatus.CANDIDATE, record, record.fingerprint(), null);
    }

    public static ExtractionResult duplicate(String filename, Fingerprint fingerprint) {
        return new ExtractionResult(filename, ExtractionStatus.DUPLICATE, null, fingerprint, null);
    }

    public static ExtractionResult failed(String filename, String error) {
        return new ExtractionResult(filename, ExtractionStatus.FAILED, null, null, error);
    }
}
