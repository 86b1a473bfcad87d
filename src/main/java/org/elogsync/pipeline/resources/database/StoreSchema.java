package org.elogsync.pipeline.resources.database;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * DDL of the store. Every child table is keyed by natural keys so that writing the same bundle
 * twice yields identical rows.
 */
final class StoreSchema {

    static final List<String> TABLES = List.of(
        "Experiment", "Run", "RunProductionData", "Detector", "RunDetector",
        "Logbook", "Questionnaire", "Workflow", "Metadata");

    private static final List<String> STATEMENTS = List.of(
        """
        CREATE TABLE IF NOT EXISTS Experiment (
            experiment_id TEXT PRIMARY KEY,
            name TEXT,
            instrument TEXT,
            start_time DATETIME,
            end_time DATETIME,
            pi TEXT,
            pi_email TEXT,
            leader_account TEXT,
            description TEXT,
            slack_channels TEXT,
            analysis_queues TEXT,
            urawi_proposal TEXT
        )""",
        """
        CREATE TABLE IF NOT EXISTS Run (
            experiment_id TEXT NOT NULL,
            run_number INTEGER NOT NULL,
            start_time DATETIME,
            end_time DATETIME,
            PRIMARY KEY (experiment_id, run_number),
            FOREIGN KEY (experiment_id) REFERENCES Experiment(experiment_id)
        )""",
        """
        CREATE TABLE IF NOT EXISTS RunProductionData (
            experiment_id TEXT NOT NULL,
            run_number INTEGER NOT NULL,
            n_events INTEGER,
            n_damaged INTEGER,
            n_dropped INTEGER,
            prod_start DATETIME,
            prod_end DATETIME,
            number_of_files INTEGER,
            total_size_bytes INTEGER,
            PRIMARY KEY (experiment_id, run_number),
            FOREIGN KEY (experiment_id, run_number) REFERENCES Run(experiment_id, run_number)
        )""",
        """
        CREATE TABLE IF NOT EXISTS Detector (
            detector_name TEXT PRIMARY KEY,
            description TEXT
        )""",
        """
        CREATE TABLE IF NOT EXISTS RunDetector (
            experiment_id TEXT NOT NULL,
            run_number INTEGER NOT NULL,
            detector_name TEXT NOT NULL,
            status TEXT NOT NULL,
            PRIMARY KEY (experiment_id, run_number, detector_name),
            FOREIGN KEY (experiment_id, run_number) REFERENCES Run(experiment_id, run_number),
            FOREIGN KEY (detector_name) REFERENCES Detector(detector_name)
        )""",
        """
        CREATE TABLE IF NOT EXISTS Logbook (
            log_id TEXT PRIMARY KEY,
            experiment_id TEXT NOT NULL,
            run_number INTEGER,
            timestamp DATETIME NOT NULL,
            content TEXT,
            tags TEXT,
            author TEXT,
            FOREIGN KEY (experiment_id) REFERENCES Experiment(experiment_id)
        )""",
        """
        CREATE TABLE IF NOT EXISTS Questionnaire (
            experiment_id TEXT NOT NULL,
            field_id TEXT NOT NULL,
            proposal TEXT,
            category TEXT NOT NULL,
            field_name TEXT,
            field_value TEXT,
            modified_time DATETIME,
            modified_uid TEXT,
            PRIMARY KEY (experiment_id, field_id),
            FOREIGN KEY (experiment_id) REFERENCES Experiment(experiment_id)
        )""",
        """
        CREATE TABLE IF NOT EXISTS Workflow (
            experiment_id TEXT NOT NULL,
            workflow_key TEXT NOT NULL,
            name TEXT,
            executable TEXT,
            "trigger" TEXT,
            location TEXT,
            parameters TEXT,
            run_param_name TEXT,
            run_param_value TEXT,
            run_as_user TEXT,
            PRIMARY KEY (experiment_id, workflow_key),
            FOREIGN KEY (experiment_id) REFERENCES Experiment(experiment_id)
        )""",
        """
        CREATE TABLE IF NOT EXISTS Metadata (
            key TEXT PRIMARY KEY,
            value TEXT
        )""",
        "CREATE INDEX IF NOT EXISTS idx_questionnaire_experiment ON Questionnaire(experiment_id)",
        "CREATE INDEX IF NOT EXISTS idx_questionnaire_category ON Questionnaire(category)",
        "CREATE INDEX IF NOT EXISTS idx_questionnaire_proposal ON Questionnaire(proposal)",
        "CREATE INDEX IF NOT EXISTS idx_run_experiment ON Run(experiment_id)",
        "CREATE INDEX IF NOT EXISTS idx_logbook_experiment ON Logbook(experiment_id)",
        "CREATE INDEX IF NOT EXISTS idx_logbook_run ON Logbook(experiment_id, run_number)",
        "CREATE INDEX IF NOT EXISTS idx_workflow_experiment ON Workflow(experiment_id)",
        """
        CREATE VIEW IF NOT EXISTS RunCompleteData AS
        SELECT
            r.experiment_id,
            r.run_number,
            r.start_time,
            r.end_time,
            rpd.n_events,
            rpd.n_damaged,
            rpd.n_dropped,
            rpd.prod_start,
            rpd.prod_end,
            rpd.number_of_files,
            rpd.total_size_bytes
        FROM Run r
        LEFT JOIN RunProductionData rpd
            ON r.experiment_id = rpd.experiment_id AND r.run_number = rpd.run_number"""
    );

    private StoreSchema() {
    }

    /**
     * Creates all tables, indexes and views that do not exist yet.
     */
    static void apply(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement()) {
            for (String ddl : STATEMENTS) {
                st.execute(ddl);
            }
        }
    }
}
