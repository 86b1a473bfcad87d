package org.elogsync.cli;

import org.elogsync.pipeline.api.contracts.ErrorKind;
import org.elogsync.pipeline.api.contracts.LedgerEntry;
import org.elogsync.pipeline.api.contracts.RunSummary;
import org.elogsync.pipeline.api.resources.OperationalError;
import org.elogsync.pipeline.api.resources.ResourceStatus;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class RunSummaryPrinterTest {

    private static final Instant NOON = Instant.parse("2024-05-01T12:00:00Z");

    private static String print(RunSummary summary) {
        StringWriter text = new StringWriter();
        RunSummaryPrinter.print(new PrintWriter(text), summary);
        return text.toString();
    }

    @Test
    void printsCountsFailuresAndResourceWarnings() {
        ResourceStatus store = new ResourceStatus("store", false, Map.of("open", 0), List.of(
            new OperationalError(NOON, "JOURNAL_MODE_CONVERSION_FAILED", "Store left in WAL mode",
                "/data/elog_2024_0501_1200.db: database is locked")));
        ResourceStatus queue = new ResourceStatus("fetch-results", true, Map.of("capacity", 100), List.of());
        RunSummary summary = new RunSummary(3,
            List.of(new LedgerEntry("cxi0001", "HTTP 403", ErrorKind.FETCH_PERMANENT, 1, NOON.toString())),
            Path.of("/data/elog_2024_0501_1200.db"), Path.of("/data/failed_experiments.json"), false,
            List.of(store, queue));

        String output = print(summary);

        assertThat(output)
            .contains("Committed: 3")
            .contains("Failed:    1")
            .contains("Ledger:    /data/failed_experiments.json")
            .contains("  cxi0001 [FETCH_PERMANENT] HTTP 403")
            .contains("Warning: store: Store left in WAL mode (/data/elog_2024_0501_1200.db: database is locked)")
            .doesNotContain("fetch-results");
        assertThat(summary.unhealthyResources()).containsExactly(store);
    }

    @Test
    void healthyRunPrintsNoWarnings() {
        RunSummary summary = new RunSummary(1, List.of(), Path.of("/data/store.db"), null, false,
            List.of(new ResourceStatus("store", true, Map.of(), List.of())));

        assertThat(print(summary)).doesNotContain("Warning").doesNotContain("Ledger");
    }
}
