package org.elogsync.pipeline.api.source;

import org.elogsync.pipeline.api.resources.SyncException;

/**
 * The experiment listing could not be obtained. Aborts the run before anything is written.
 */
public class SourceUnavailableException extends SyncException {

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
