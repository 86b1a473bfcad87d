package org.elogsync.pipeline.api.resources;

import java.time.Instant;

/**
 * Structured record of a non-fatal error that occurred within a pipeline component.
 *
 * @param timestamp When the error occurred.
 * @param errorType A category for the error (e.g., "HTTP_5XX", "BATCH_ROLLBACK").
 * @param message   A human-readable description of the error.
 * @param details   Optional context such as the affected experiment identifiers.
 */
public record OperationalError(
    Instant timestamp,
    String errorType,
    String message,
    String details
) {
}
