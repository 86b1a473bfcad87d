package org.elogsync.pipeline.api.source;

import org.elogsync.pipeline.api.resources.SyncException;

/**
 * A failed call to the remote source. Subclasses tell whether retrying may help.
 */
public abstract class RemoteSourceException extends SyncException {

    private final int statusCode;

    protected RemoteSourceException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * @return The HTTP status code, or {@code -1} if no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
