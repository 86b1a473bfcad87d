package org.elogsync.cli;

import org.elogsync.pipeline.api.contracts.LedgerEntry;
import org.elogsync.pipeline.api.contracts.RunSummary;
import org.elogsync.pipeline.api.resources.OperationalError;
import org.elogsync.pipeline.api.resources.ResourceStatus;

import java.io.PrintWriter;

/**
 * Renders a {@link RunSummary} for the terminal.
 */
public final class RunSummaryPrinter {

    private static final int MAX_LISTED_FAILURES = 20;

    private RunSummaryPrinter() {
    }

    public static void print(PrintWriter out, RunSummary summary) {
        out.println("Committed: " + summary.committed());
        out.println("Failed:    " + summary.failed());
        if (summary.storePath() != null) {
            out.println("Store:     " + summary.storePath());
        }
        summary.ledger().ifPresent(path -> out.println("Ledger:    " + path));
        if (summary.cancelled()) {
            out.println("Run was cancelled; remaining experiments are recorded in the ledger.");
        }
        int listed = 0;
        for (LedgerEntry entry : summary.failures()) {
            if (listed++ == MAX_LISTED_FAILURES) {
                out.println("  ... and " + (summary.failed() - MAX_LISTED_FAILURES) + " more");
                break;
            }
            out.printf("  %s [%s] %s%n", entry.experimentId(), entry.errorKind(), entry.error());
        }
        for (ResourceStatus resource : summary.unhealthyResources()) {
            for (OperationalError error : resource.errors()) {
                out.printf("Warning: %s: %s (%s)%n", resource.name(), error.message(), error.details());
            }
        }
        out.flush();
    }
}
