package org.elogsync.pipeline.api.resources;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Exclusive, cross-process lease on a store directory.
 * <p>
 * Implementations must tie the lease to the liveness of the owning process so that a crashed
 * run never leaves a stale lock behind.
 */
public interface IStoreLock {

    /**
     * Acquires the lease for the given lock file.
     *
     * @param lockFile The lock file, created if absent.
     * @param blocking If {@code false}, fail immediately when the lock is held elsewhere.
     * @return A lease that releases the lock when closed.
     * @throws AlreadyRunningException if {@code blocking} is false and another holder exists.
     * @throws IOException             if the lock file cannot be opened.
     */
    Lease acquire(Path lockFile, boolean blocking) throws AlreadyRunningException, IOException;

    /**
     * A held lock. Closing it releases the lock. Closing twice is a no-op.
     */
    interface Lease extends AutoCloseable {

        Path lockFile();

        @Override
        void close() throws IOException;
    }
}
