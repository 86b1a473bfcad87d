package org.elogsync.pipeline.api.contracts;

import java.util.Objects;

/**
 * Top-level experiment information (one row of the {@code Experiment} table).
 */
public record ExperimentRecord(
    String experimentId,
    String name,
    String instrument,
    String startTime,
    String endTime,
    String pi,
    String piEmail,
    String leaderAccount,
    String description,
    String slackChannels,
    String analysisQueues,
    String urawiProposal
) {
    public ExperimentRecord {
        Objects.requireNonNull(experimentId, "experimentId must not be null");
    }

    /**
     * Minimal record carrying only the identifier, used when the remote source returns no details.
     */
    public static ExperimentRecord idOnly(String experimentId) {
        return new ExperimentRecord(experimentId, null, null, null, null, null, null, null, null, null, null, null);
    }
}
