package net.gridcollate.model.ledger;

import net.gridcollate.model.image.Fingerprint;

/**
 * One accepted image in the append-only ledger.
 *
 * @param category category name
 * @param subcategory subcategory label
 * @param batchNumber batch the image was rendered into
 * @param fingerprint perceptual fingerprint
 * @param filename source file name
 */
public record LedgerEntry(
        String category,
        String subcategory,
        int batchNumber,
        Fingerprint fingerprint,
        String filename) {

    public LedgerEntry {
        if (batchNumber < 1) {
            throw new IllegalArgumentException("batchNumber must start at 1: " + batchNumber);
        }
        if (fingerprint == null) {
            throw new IllegalArgumentException("fingerprint is required");
        }
    }
}
