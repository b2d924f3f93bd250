package net.gridcollate.service.ledger;

import java.nio.file.Path;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import net.gridcollate.model.image.Fingerprint;
import net.gridcollate.model.ledger.LedgerEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cross-run memory of accepted fingerprints.
 *
 * <p>The in-memory index maps each fingerprint to the most recent batch it was rendered
 * into. Fingerprints accepted during the current run but not yet rendered are held as
 * reservations so a second file with the same content is rejected. Only
 * {@link #append(List)} turns reservations into ledger rows; reservations that never
 * make it into a batch are not persisted, so those files are reconsidered next run.</p>
 *
 * <p>Extraction workers call {@link #checkAndMark(Fingerprint)} concurrently; every
 * method holds the instance monitor so check-and-reserve is a single atomic step.
 * {@link #append(List)} is called only from the coordinating thread.</p>
 */
public class DuplicateLedger {

    private static final Logger logger = LoggerFactory.getLogger(DuplicateLedger.class);

    private final LedgerCsvStore store;
    private final Map<Fingerprint, Integer> batchByFingerprint = new HashMap<>();
    private final Set<Fingerprint> reserved = new HashSet<>();

    private DuplicateLedger(LedgerCsvStore store) {
        this.store = store;
    }

    /**
     * Rebuilds the index by replaying every row in the backing store.
     *
     * @throws net.gridcollate.exception.LedgerException when the store cannot be read
     */
    public static DuplicateLedger load(LedgerCsvStore store) {
        DuplicateLedger ledger = new DuplicateLedger(store);
        List<LedgerEntry> history = store.readAll();
        synchronized (ledger) {
            history.forEach(ledger::index);
        }
        logger.info("Ledger index holds {} distinct fingerprint(s) from {} row(s).",
            ledger.size(), history.size());
        return ledger;
    }

    /**
     * Reports whether {@code fingerprint} is already known and, when it is not,
     * reserves it for the current run.
     *
     * @return {@code true} when the fingerprint is a duplicate
     */
    public synchronized boolean checkAndMark(Fingerprint fingerprint) {
        if (batchByFingerprint.containsKey(fingerprint) || reserved.contains(fingerprint)) {
            return true;
        }
        reserved.add(fingerprint);
        return false;
    }

    /**
     * Drops reservations for images whose batch was abandoned, so they can be accepted again.
     */
    public synchronized void release(Collection<Fingerprint> fingerprints) {
        fingerprints.forEach(reserved::remove);
    }

    /**
     * Persists a rendered batch's entries, then records them in the index.
     *
     * @throws net.gridcollate.exception.LedgerException when the append fails; the index is left unchanged
     */
    public synchronized void append(List<LedgerEntry> entries) {
        if (entries.isEmpty()) {
            return;
        }
        store.append(entries);
        for (LedgerEntry entry : entries) {
            index(entry);
            reserved.remove(entry.fingerprint());
        }
    }

    /** Most recent batch the fingerprint was rendered into, if any. */
    public synchronized Optional<Integer> batchOf(Fingerprint fingerprint) {
        return Optional.ofNullable(batchByFingerprint.get(fingerprint));
    }

    synchronized boolean isReserved(Fingerprint fingerprint) {
        return reserved.contains(fingerprint);
    }

    public synchronized int size() {
        return batchByFingerprint.size();
    }

    public Path getFile() {
        return store.getFile();
    }

    private void index(LedgerEntry entry) {
        batchByFingerprint.put(entry.fingerprint(), entry.batchNumber());
    }
}
