package org.elogsync.pipeline.api.contracts;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * One line of the failure ledger file.
 * <p>
 * Unknown properties are ignored so that ledgers written by older tooling (which only carried
 * {@code experiment_id}, {@code error} and {@code timestamp}) remain loadable.
 *
 * @param experimentId The failed experiment
 * @param error        Error summary
 * @param errorKind    Failure classification, may be {@code null} for legacy entries
 * @param attempts     Attempts made during the failing run
 * @param timestamp    ISO-8601 instant at which the failure was recorded
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LedgerEntry(
    @JsonProperty("experiment_id") String experimentId,
    @JsonProperty("error") String error,
    @JsonProperty("error_kind") ErrorKind errorKind,
    @JsonProperty("attempts") int attempts,
    @JsonProperty("timestamp") String timestamp
) {

    public LedgerEntry {
        Objects.requireNonNull(experimentId, "experiment_id must not be null");
    }

    /**
     * Creates a ledger entry from a terminal fetch or persistence failure.
     */
    public static LedgerEntry of(FetchResult.Failure failure, Instant at) {
        return new LedgerEntry(failure.identifier(), failure.error(), failure.kind(), failure.attempts(), at.toString());
    }
}
