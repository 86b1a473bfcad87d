package org.elogsync.pipeline.api.source;

import org.elogsync.pipeline.api.contracts.RecordBundle;
import org.elogsync.pipeline.api.resources.IResource;

import java.time.Duration;
import java.util.List;

/**
 * The remote experiment catalog.
 * <p>
 * Implementations must be safe for concurrent use: {@link #fetchRecord(String)} is called from
 * several fetch workers at once.
 */
public interface IRemoteSource extends IResource {

    /**
     * Lists the identifiers of experiments with activity inside the given window.
     * Implementations apply their own retry budget before giving up.
     *
     * @param window Lookback window, ending now.
     * @return Identifiers in the order reported by the source, possibly with duplicates.
     * @throws SourceUnavailableException if the listing cannot be completed.
     * @throws InterruptedException       if interrupted while waiting between attempts.
     */
    List<String> listChanged(Duration window) throws SourceUnavailableException, InterruptedException;

    /**
     * Fetches the complete record bundle of one experiment. This is a single attempt; retrying
     * is the caller's concern.
     *
     * @param experimentId The experiment identifier.
     * @return The full bundle, never partially populated.
     * @throws TransientSourceException if the attempt failed for a reason worth retrying.
     * @throws PermanentSourceException if retrying cannot help.
     * @throws InterruptedException     if the calling thread was interrupted.
     */
    RecordBundle fetchRecord(String experimentId)
        throws TransientSourceException, PermanentSourceException, InterruptedException;

    /**
     * Verifies that a credential is available before a run starts.
     *
     * @throws AuthenticationException if fetches would be rejected for lack of a credential.
     */
    default void checkCredentials() throws AuthenticationException {
    }
}
