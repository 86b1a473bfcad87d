package org.elogsync.pipeline.api.resources;

/**
 * Base class of the checked exceptions raised by the sync pipeline.
 */
public class SyncException extends Exception {

    public SyncException(String message) {
        super(message);
    }

    public SyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
