package org.elogsync.pipeline.api.resources;

import java.nio.file.Path;

/**
 * Thrown when a failure ledger file cannot be read or parsed.
 */
public class CorruptLedgerException extends SyncException {

    private final Path ledgerPath;

    public CorruptLedgerException(Path ledgerPath, String reason, Throwable cause) {
        super("Failure ledger " + ledgerPath + " is unreadable: " + reason, cause);
        this.ledgerPath = ledgerPath;
    }

    public Path getLedgerPath() {
        return ledgerPath;
    }
}
