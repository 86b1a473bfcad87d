package org.elogsync.pipeline.api.contracts;

import java.util.Objects;

/**
 * Outcome of fetching one experiment. Workers hand these values to the writer instead of
 * throwing across the thread boundary.
 */
public sealed interface FetchResult permits FetchResult.Success, FetchResult.Failure {

    /**
     * @return The experiment identifier this result belongs to
     */
    String identifier();

    /**
     * A fully populated record bundle.
     *
     * @param identifier The experiment identifier
     * @param bundle     The complete bundle, never partially populated
     * @param attempts   Number of attempts it took to fetch the bundle
     */
    record Success(String identifier, RecordBundle bundle, int attempts) implements FetchResult {
        public Success {
            Objects.requireNonNull(identifier, "identifier must not be null");
            Objects.requireNonNull(bundle, "bundle must not be null");
            if (!identifier.equals(bundle.experimentId())) {
                throw new IllegalArgumentException(
                    "Bundle for '" + bundle.experimentId() + "' cannot be reported as '" + identifier + "'");
            }
        }
    }

    /**
     * A terminal failure.
     *
     * @param identifier The experiment identifier
     * @param kind       Failure classification
     * @param error      Short human-readable error summary
     * @param attempts   Number of attempts made before giving up (0 if never dispatched)
     */
    record Failure(String identifier, ErrorKind kind, String error, int attempts) implements FetchResult {
        public Failure {
            Objects.requireNonNull(identifier, "identifier must not be null");
            Objects.requireNonNull(kind, "kind must not be null");
            error = error != null ? error : kind.name();
        }
    }
}
