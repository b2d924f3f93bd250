package net.gridcollate.exception;

import java.nio.file.Path;

/**
 * The duplicate ledger could not be read or appended to.
 * FATAL: without a consistent ledger, cross-run dedup cannot be guaranteed.
 */
public class LedgerException extends CollateException {

    private final transient Path ledgerFile;

    public LedgerException(String message, Path ledgerFile, Throwable cause) {
        super(message + " (" + ledgerFile + ")", true, cause);
        this.ledgerFile = ledgerFile;
    }

    public Path getLedgerFile() {
        return ledgerFile;
    }
}
