package org.elogsync.cli.commands;

import org.elogsync.cli.CommandLineInterface;
import org.elogsync.config.SyncSettings;
import org.elogsync.pipeline.resources.database.SqliteStore;
import org.elogsync.pipeline.resources.database.StoreNaming;
import org.elogsync.pipeline.resources.database.StoreReader;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
    name = "status",
    description = "Shows the latest store, its sync metadata and row counts"
)
public class StatusCommand implements Callable<Integer> {

    private static final List<String> REPORTED_METADATA = List.of(
        SqliteStore.META_LAST_UPDATE,
        SqliteStore.META_LAST_SUCCESSFUL_SYNC,
        SqliteStore.META_HOURS_LOOKBACK);

    @Option(names = {"-d", "--database-dir"}, description = "Directory holding the stores")
    private Path databaseDir;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        SyncSettings settings = parent.getSettings();
        Path dir = databaseDir != null ? databaseDir : settings.databaseDir();
        PrintWriter out = spec.commandLine().getOut();

        Optional<Path> latest = Files.isDirectory(dir)
            ? new StoreNaming(settings.storePrefix()).findLatest(dir)
            : Optional.empty();
        if (latest.isEmpty()) {
            out.println("No store found in " + dir.toAbsolutePath());
            out.flush();
            return CommandLineInterface.EXIT_ABORTED;
        }

        Path store = latest.get();
        out.println("Store:         " + store.toAbsolutePath());
        out.printf("Size:          %.1f MB%n", Files.size(store) / (1024.0 * 1024.0));
        out.println("Modified:      " + Files.getLastModifiedTime(store));
        try (StoreReader reader = StoreReader.open(store)) {
            for (String key : REPORTED_METADATA) {
                out.printf("%-14s %s%n", key + ":", reader.metadata(key).orElse("-"));
            }
            out.println("Rows:");
            for (Map.Entry<String, Long> entry : reader.rowCounts().entrySet()) {
                out.printf("  %-18s %d%n", entry.getKey(), entry.getValue());
            }
        }
        Path ledger = settings.ledgerFile(dir);
        if (Files.exists(ledger)) {
            out.println("Failure ledger: " + ledger.toAbsolutePath());
        }
        out.flush();
        return CommandLineInterface.EXIT_OK;
    }
}
