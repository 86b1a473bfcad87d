package org.elogsync.pipeline.api.contracts;

import java.util.Objects;

/**
 * A single elog entry.
 *
 * @param logId     Remote entry id, unique across experiments
 * @param runNumber Explicit or inferred run number, {@code null} if the entry precedes every run
 * @param timestamp Insert time as reported by the remote source
 * @param content   Entry text
 * @param tags      Comma-separated tags, {@code null} if untagged
 * @param author    Author account
 */
public record LogbookEntry(String logId, Integer runNumber, String timestamp, String content, String tags,
                           String author) {
    public LogbookEntry {
        Objects.requireNonNull(logId, "logId must not be null");
    }
}
