package org.elogsync.pipeline.api.resources;

import java.nio.file.Path;

/**
 * Thrown when another process already holds the lock for a store directory.
 * The run aborts before the store is opened.
 */
public class AlreadyRunningException extends SyncException {

    private final Path lockPath;

    public AlreadyRunningException(Path lockPath) {
        super("Another instance is already running (lock: " + lockPath + ")");
        this.lockPath = lockPath;
    }

    public Path getLockPath() {
        return lockPath;
    }
}
