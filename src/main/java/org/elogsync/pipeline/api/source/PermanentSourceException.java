package org.elogsync.pipeline.api.source;

/**
 * Authorization failures, client errors and responses that cannot be interpreted.
 */
public class PermanentSourceException extends RemoteSourceException {

    public PermanentSourceException(String message) {
        super(message, -1, null);
    }

    public PermanentSourceException(String message, int statusCode) {
        super(message, statusCode, null);
    }

    public PermanentSourceException(String message, Throwable cause) {
        super(message, -1, cause);
    }
}
