package org.elogsync.pipeline.api.contracts;

import java.util.List;
import java.util.Objects;

/**
 * The complete state of one experiment as fetched from the remote source.
 * <p>
 * A bundle is authoritative: when it is written, every child row previously stored for the
 * experiment is replaced by the rows carried here.
 */
public record RecordBundle(
    String experimentId,
    ExperimentRecord experiment,
    List<RunRecord> runs,
    List<DetectorStatus> detectors,
    List<LogbookEntry> logbook,
    List<QuestionnaireField> questionnaire,
    List<WorkflowDefinition> workflows
) {
    public RecordBundle {
        Objects.requireNonNull(experimentId, "experimentId must not be null");
        experiment = experiment != null ? experiment : ExperimentRecord.idOnly(experimentId);
        if (!experimentId.equals(experiment.experimentId())) {
            throw new IllegalArgumentException("Experiment record '" + experiment.experimentId()
                + "' does not belong to bundle '" + experimentId + "'");
        }
        runs = runs == null ? List.of() : List.copyOf(runs);
        detectors = detectors == null ? List.of() : List.copyOf(detectors);
        logbook = logbook == null ? List.of() : List.copyOf(logbook);
        questionnaire = questionnaire == null ? List.of() : List.copyOf(questionnaire);
        workflows = workflows == null ? List.of() : List.copyOf(workflows);
    }

    /**
     * @return A bundle with only the experiment row and no child rows
     */
    public static RecordBundle empty(String experimentId) {
        return new RecordBundle(experimentId, null, null, null, null, null, null);
    }

    /**
     * @return Total number of rows this bundle will write, the experiment row included
     */
    public int rowCount() {
        return 1 + runs.size() + detectors.size() + logbook.size() + questionnaire.size() + workflows.size();
    }
}
