package org.elogsync.pipeline.api.contracts;

/**
 * Classification of a terminal per-experiment failure.
 */
public enum ErrorKind {
    /** Transient remote errors that exhausted the retry budget. */
    FETCH_TRANSIENT,
    /** Authorization, validation or malformed-response errors. Never retried. */
    FETCH_PERMANENT,
    /** The fetch succeeded but the batch holding the bundle failed to commit. */
    PERSISTENCE,
    /** The run was cancelled before the experiment was dispatched. */
    CANCELLED
}
