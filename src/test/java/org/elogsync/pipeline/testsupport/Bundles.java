package org.elogsync.pipeline.testsupport;

import org.elogsync.pipeline.api.contracts.DetectorStatus;
import org.elogsync.pipeline.api.contracts.ExperimentRecord;
import org.elogsync.pipeline.api.contracts.LogbookEntry;
import org.elogsync.pipeline.api.contracts.QuestionnaireField;
import org.elogsync.pipeline.api.contracts.RecordBundle;
import org.elogsync.pipeline.api.contracts.RunRecord;
import org.elogsync.pipeline.api.contracts.WorkflowDefinition;

import java.util.ArrayList;
import java.util.List;

/**
 * Sample record bundles with a deterministic shape derived from the experiment id.
 */
public final class Bundles {

    private Bundles() {
    }

    /**
     * A bundle with {@code runs} runs, two detectors per run, one logbook entry per run, one
     * questionnaire field and one workflow.
     */
    public static RecordBundle sample(String experimentId, int runs) {
        ExperimentRecord experiment = new ExperimentRecord(experimentId, experimentId.toUpperCase(),
            experimentId.substring(0, 3).toUpperCase(), "2024-01-01 08:00:00", "2024-01-03 08:00:00",
            "Ada Lovelace", "ada@example.org", "opr" + experimentId.substring(0, 3), "Sample experiment",
            "#" + experimentId, "milano", "1234");
        List<RunRecord> runRecords = new ArrayList<>();
        List<DetectorStatus> detectors = new ArrayList<>();
        List<LogbookEntry> logbook = new ArrayList<>();
        for (int run = 1; run <= runs; run++) {
            runRecords.add(new RunRecord(run, "2024-01-01 0" + run + ":00:00", "2024-01-01 0" + run + ":30:00",
                1000L * run, (long) run, 0L, null, null, 2L, 4096L * run));
            detectors.add(new DetectorStatus(run, "DAQ Detectors/epix_1", DetectorStatus.CHECKED));
            detectors.add(new DetectorStatus(run, "DAQ Detectors/jungfrau", DetectorStatus.UNCHECKED));
            logbook.add(new LogbookEntry(experimentId + "-log-" + run, run, "2024-01-01 0" + run + ":05:00",
                "run " + run + " looks good", "DAQ", "operator"));
        }
        List<QuestionnaireField> questionnaire = List.of(new QuestionnaireField("1234", "sample",
            "sample-name", "name", "lysozyme", "2024-01-01 07:00:00", "ada"));
        List<WorkflowDefinition> workflows = List.of(new WorkflowDefinition("wf-" + experimentId, "smd",
            "/sdf/bin/smd.sh", "END_OF_RUN", "S3DF", "{\"cores\":\"4\"}", "run", "1", "ada"));
        return new RecordBundle(experimentId, experiment, runRecords, detectors, logbook, questionnaire, workflows);
    }

    public static RecordBundle sample(String experimentId) {
        return sample(experimentId, 2);
    }
}
