package org.elogsync.pipeline.resources.database;

import org.elogsync.pipeline.api.contracts.DetectorStatus;
import org.elogsync.pipeline.api.contracts.ExperimentRecord;
import org.elogsync.pipeline.api.contracts.LogbookEntry;
import org.elogsync.pipeline.api.contracts.QuestionnaireField;
import org.elogsync.pipeline.api.contracts.RecordBundle;
import org.elogsync.pipeline.api.contracts.RunRecord;
import org.elogsync.pipeline.api.contracts.WorkflowDefinition;
import org.elogsync.pipeline.api.resources.IBundleWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Writes record bundles through the store's single writer connection.
 * <p>
 * Within the batch transaction each experiment's child rows are deleted and re-inserted from the
 * bundle, and the experiment row itself is upserted. Writing an identical bundle twice therefore
 * leaves identical rows behind.
 */
public class SqliteBundleWriter implements IBundleWriter {

    private static final Logger log = LoggerFactory.getLogger(SqliteBundleWriter.class);

    static final String UPSERT_METADATA =
        "INSERT INTO Metadata (key, value) VALUES (?, ?) ON CONFLICT(key) DO UPDATE SET value = excluded.value";

    private static final String UPSERT_EXPERIMENT = """
        INSERT INTO Experiment (experiment_id, name, instrument, start_time, end_time, pi, pi_email,
                                leader_account, description, slack_channels, analysis_queues, urawi_proposal)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT(experiment_id) DO UPDATE SET
            name = excluded.name,
            instrument = excluded.instrument,
            start_time = excluded.start_time,
            end_time = excluded.end_time,
            pi = excluded.pi,
            pi_email = excluded.pi_email,
            leader_account = excluded.leader_account,
            description = excluded.description,
            slack_channels = excluded.slack_channels,
            analysis_queues = excluded.analysis_queues,
            urawi_proposal = excluded.urawi_proposal""";

    private static final String UPSERT_RUN = """
        INSERT INTO Run (experiment_id, run_number, start_time, end_time) VALUES (?, ?, ?, ?)
        ON CONFLICT(experiment_id, run_number) DO UPDATE SET
            start_time = excluded.start_time,
            end_time = excluded.end_time""";

    private static final String UPSERT_PRODUCTION = """
        INSERT INTO RunProductionData (experiment_id, run_number, n_events, n_damaged, n_dropped,
                                       prod_start, prod_end, number_of_files, total_size_bytes)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT(experiment_id, run_number) DO UPDATE SET
            n_events = excluded.n_events,
            n_damaged = excluded.n_damaged,
            n_dropped = excluded.n_dropped,
            prod_start = excluded.prod_start,
            prod_end = excluded.prod_end,
            number_of_files = excluded.number_of_files,
            total_size_bytes = excluded.total_size_bytes""";

    private static final String INSERT_DETECTOR =
        "INSERT INTO Detector (detector_name) VALUES (?) ON CONFLICT(detector_name) DO NOTHING";

    private static final String UPSERT_RUN_DETECTOR = """
        INSERT INTO RunDetector (experiment_id, run_number, detector_name, status) VALUES (?, ?, ?, ?)
        ON CONFLICT(experiment_id, run_number, detector_name) DO UPDATE SET status = excluded.status""";

    private static final String UPSERT_LOGBOOK = """
        INSERT INTO Logbook (log_id, experiment_id, run_number, timestamp, content, tags, author)
        VALUES (?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT(log_id) DO UPDATE SET
            experiment_id = excluded.experiment_id,
            run_number = excluded.run_number,
            timestamp = excluded.timestamp,
            content = excluded.content,
            tags = excluded.tags,
            author = excluded.author""";

    private static final String UPSERT_QUESTIONNAIRE = """
        INSERT INTO Questionnaire (experiment_id, field_id, proposal, category, field_name, field_value,
                                   modified_time, modified_uid)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT(experiment_id, field_id) DO UPDATE SET
            proposal = excluded.proposal,
            category = excluded.category,
            field_name = excluded.field_name,
            field_value = excluded.field_value,
            modified_time = excluded.modified_time,
            modified_uid = excluded.modified_uid""";

    private static final String UPSERT_WORKFLOW = """
        INSERT INTO Workflow (experiment_id, workflow_key, name, executable, "trigger", location, parameters,
                              run_param_name, run_param_value, run_as_user)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT(experiment_id, workflow_key) DO UPDATE SET
            name = excluded.name,
            executable = excluded.executable,
            "trigger" = excluded."trigger",
            location = excluded.location,
            parameters = excluded.parameters,
            run_param_name = excluded.run_param_name,
            run_param_value = excluded.run_param_value,
            run_as_user = excluded.run_as_user""";

    // children first, Run last
    private static final List<String> CHILD_TABLES = List.of(
        "RunDetector", "RunProductionData", "Logbook", "Questionnaire", "Workflow", "Run");

    private final SqliteStore store;

    public SqliteBundleWriter(SqliteStore store) {
        this.store = store;
    }

    @Override
    public void writeBatch(List<RecordBundle> bundles, Instant committedAt) throws SQLException {
        Connection conn = store.connection();
        conn.setAutoCommit(false);
        try {
            for (RecordBundle bundle : bundles) {
                writeBundle(conn, bundle);
            }
            try (PreparedStatement ps = conn.prepareStatement(UPSERT_METADATA)) {
                for (RecordBundle bundle : bundles) {
                    ps.setString(1, "experiment:" + bundle.experimentId() + ":synced_at");
                    ps.setString(2, committedAt.toString());
                    ps.addBatch();
                }
                ps.setString(1, SqliteStore.META_LAST_UPDATE);
                ps.setString(2, committedAt.toString());
                ps.addBatch();
                ps.executeBatch();
            }
            conn.commit();
            log.debug("Committed batch of {} experiments", bundles.size());
        } catch (SQLException | RuntimeException e) {
            rollback(conn);
            throw e;
        } finally {
            conn.setAutoCommit(true);
        }
    }

    private void rollback(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            log.debug("Rollback failed: {}", e.getMessage());
        }
    }

    private void writeBundle(Connection conn, RecordBundle bundle) throws SQLException {
        String experimentId = bundle.experimentId();

        for (String table : CHILD_TABLES) {
            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM " + table + " WHERE experiment_id = ?")) {
                ps.setString(1, experimentId);
                ps.executeUpdate();
            }
        }

        writeExperiment(conn, bundle.experiment());
        writeRuns(conn, experimentId, bundle.runs());
        writeDetectors(conn, experimentId, bundle.detectors());
        writeLogbook(conn, experimentId, bundle.logbook());
        writeQuestionnaire(conn, experimentId, bundle.questionnaire());
        writeWorkflows(conn, experimentId, bundle.workflows());
        log.debug("Wrote {} rows for {}", bundle.rowCount(), experimentId);
    }

    private void writeExperiment(Connection conn, ExperimentRecord e) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(UPSERT_EXPERIMENT)) {
            ps.setString(1, e.experimentId());
            ps.setString(2, e.name());
            ps.setString(3, e.instrument());
            ps.setString(4, e.startTime());
            ps.setString(5, e.endTime());
            ps.setString(6, e.pi());
            ps.setString(7, e.piEmail());
            ps.setString(8, e.leaderAccount());
            ps.setString(9, e.description());
            ps.setString(10, e.slackChannels());
            ps.setString(11, e.analysisQueues());
            ps.setString(12, e.urawiProposal());
            ps.executeUpdate();
        }
    }

    private void writeRuns(Connection conn, String experimentId, List<RunRecord> runs) throws SQLException {
        if (runs.isEmpty()) {
            return;
        }
        try (PreparedStatement run = conn.prepareStatement(UPSERT_RUN);
             PreparedStatement production = conn.prepareStatement(UPSERT_PRODUCTION)) {
            for (RunRecord r : runs) {
                run.setString(1, experimentId);
                run.setInt(2, r.runNumber());
                run.setString(3, r.startTime());
                run.setString(4, r.endTime());
                run.addBatch();

                production.setString(1, experimentId);
                production.setInt(2, r.runNumber());
                setLong(production, 3, r.events());
                setLong(production, 4, r.damaged());
                setLong(production, 5, r.dropped());
                production.setString(6, r.prodStart());
                production.setString(7, r.prodEnd());
                setLong(production, 8, r.numberOfFiles());
                setLong(production, 9, r.totalSizeBytes());
                production.addBatch();
            }
            run.executeBatch();
            production.executeBatch();
        }
    }

    private void writeDetectors(Connection conn, String experimentId, List<DetectorStatus> detectors) throws SQLException {
        if (detectors.isEmpty()) {
            return;
        }
        Set<String> names = new LinkedHashSet<>();
        detectors.forEach(d -> names.add(d.detectorName()));
        try (PreparedStatement detector = conn.prepareStatement(INSERT_DETECTOR)) {
            for (String name : names) {
                detector.setString(1, name);
                detector.addBatch();
            }
            detector.executeBatch();
        }
        // make sure every referenced run exists, detector rows may name runs without run details
        try (PreparedStatement run = conn.prepareStatement(
                 "INSERT INTO Run (experiment_id, run_number) VALUES (?, ?) ON CONFLICT DO NOTHING");
             PreparedStatement status = conn.prepareStatement(UPSERT_RUN_DETECTOR)) {
            for (DetectorStatus d : detectors) {
                run.setString(1, experimentId);
                run.setInt(2, d.runNumber());
                run.addBatch();

                status.setString(1, experimentId);
                status.setInt(2, d.runNumber());
                status.setString(3, d.detectorName());
                status.setString(4, d.status());
                status.addBatch();
            }
            run.executeBatch();
            status.executeBatch();
        }
    }

    private void writeLogbook(Connection conn, String experimentId, List<LogbookEntry> entries) throws SQLException {
        if (entries.isEmpty()) {
            return;
        }
        try (PreparedStatement ps = conn.prepareStatement(UPSERT_LOGBOOK)) {
            for (LogbookEntry entry : entries) {
                ps.setString(1, entry.logId());
                ps.setString(2, experimentId);
                if (entry.runNumber() != null) {
                    ps.setInt(3, entry.runNumber());
                } else {
                    ps.setNull(3, Types.INTEGER);
                }
                ps.setString(4, entry.timestamp() != null ? entry.timestamp() : "");
                ps.setString(5, entry.content());
                ps.setString(6, entry.tags());
                ps.setString(7, entry.author());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private void writeQuestionnaire(Connection conn, String experimentId, List<QuestionnaireField> fields)
            throws SQLException {
        if (fields.isEmpty()) {
            return;
        }
        try (PreparedStatement ps = conn.prepareStatement(UPSERT_QUESTIONNAIRE)) {
            for (QuestionnaireField f : fields) {
                ps.setString(1, experimentId);
                ps.setString(2, f.fieldId());
                ps.setString(3, f.proposal());
                ps.setString(4, f.category());
                ps.setString(5, f.fieldName());
                ps.setString(6, f.fieldValue());
                ps.setString(7, f.modifiedTime());
                ps.setString(8, f.modifiedUid());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private void writeWorkflows(Connection conn, String experimentId, List<WorkflowDefinition> workflows)
            throws SQLException {
        if (workflows.isEmpty()) {
            return;
        }
        try (PreparedStatement ps = conn.prepareStatement(UPSERT_WORKFLOW)) {
            for (WorkflowDefinition w : workflows) {
                ps.setString(1, experimentId);
                ps.setString(2, w.workflowKey());
                ps.setString(3, w.name());
                ps.setString(4, w.executable());
                ps.setString(5, w.trigger());
                ps.setString(6, w.location());
                ps.setString(7, w.parametersJson());
                ps.setString(8, w.runParamName());
                ps.setString(9, w.runParamValue());
                ps.setString(10, w.runAsUser());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private static void setLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value != null) {
            ps.setLong(index, value);
        } else {
            ps.setNull(index, Types.BIGINT);
        }
    }
}
