package net.gridcollate.service.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import net.gridcollate.model.ledger.LedgerEntry;

/**
 * CSV shape of a {@link LedgerEntry}. Column order is part of the file format.
 */
@JsonPropertyOrder({"Category", "Subcategory", "BatchNumber", "Fingerprint", "Filename"})
record LedgerRow(
        @JsonProperty("Category") String category,
        @JsonProperty("Subcategory") String subcategory,
        @JsonProperty("BatchNumber") int batchNumber,
        @JsonProperty("Fingerprint") String fingerprint,
        @JsonProperty("Filename") String filename) {

    static LedgerRow from(LedgerEntry entry) {
        return new LedgerRow(
            entry.category(),
            entry.subcategory(),
            entry.batchNumber(),
            entry.fingerprint().toHex(),
            entry.filename());
    }
}
