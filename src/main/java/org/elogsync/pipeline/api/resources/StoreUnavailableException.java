package org.elogsync.pipeline.api.resources;

import java.nio.file.Path;

/**
 * Thrown when a store cannot be prepared or opened for a run. Nothing has been written when this
 * is raised.
 */
public class StoreUnavailableException extends SyncException {

    private final Path storePath;

    public StoreUnavailableException(Path storePath, Throwable cause) {
        super("Cannot open store " + storePath + ": " + cause.getMessage(), cause);
        this.storePath = storePath;
    }

    public StoreUnavailableException(Path storePath, String reason) {
        super("Cannot open store " + storePath + ": " + reason);
        this.storePath = storePath;
    }

    public Path getStorePath() {
        return storePath;
    }
}
