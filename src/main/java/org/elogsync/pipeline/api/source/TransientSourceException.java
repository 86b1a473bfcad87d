package org.elogsync.pipeline.api.source;

/**
 * Timeouts, connection failures, 5xx responses and rate limiting.
 */
public class TransientSourceException extends RemoteSourceException {

    public TransientSourceException(String message) {
        super(message, -1, null);
    }

    public TransientSourceException(String message, int statusCode) {
        super(message, statusCode, null);
    }

    public TransientSourceException(String message, Throwable cause) {
        super(message, -1, cause);
    }
}
