package net.gridcollate.model.image;

/**
 * Outcome of running feature extraction on one file.
 */
public enum ExtractionStatus {
    /** Features computed and the fingerprint was reserved for this run. */
    CANDIDATE,
    /** Fingerprint already known to the ledger or reserved earlier in this run. */
    DUPLICATE,
    /** Decode, resize or analysis failed. */
    FAILED
}
