package org.elogsync.cli.commands;

import org.elogsync.cli.CommandLineInterface;
import org.elogsync.cli.RunSummaryPrinter;
import org.elogsync.cli.ShutdownCancellation;
import org.elogsync.config.SyncSettings;
import org.elogsync.pipeline.api.contracts.ChangeSet;
import org.elogsync.pipeline.api.contracts.RunSummary;
import org.elogsync.pipeline.services.SyncRequest;
import org.elogsync.pipeline.services.SyncService;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "sync",
    aliases = {"update"},
    description = "Fetches experiments updated within the lookback window into a new or existing store"
)
public class SyncCommand implements Callable<Integer> {

    @Option(names = {"-H", "--hours"}, description = "Lookback window in hours (default: configured, or since the last sync with --incremental)")
    private Long hours;

    @Option(names = {"-e", "--exclude"}, description = "Exclude experiments matching this pattern (repeatable, e.g. 'txi*')")
    private List<String> exclude;

    @Option(names = {"-o", "--output-dir"}, description = "Directory for stores, lock and ledger")
    private Path outputDir;

    @Option(names = {"-p", "--parallel"}, description = "Number of concurrent fetches")
    private Integer parallel;

    @Option(names = {"-b", "--batch-size"}, description = "Experiments per transaction")
    private Integer batchSize;

    @Option(names = {"--queue-size"}, description = "Fetched results buffered before writing")
    private Integer queueSize;

    @Option(names = {"-i", "--incremental"}, arity = "0..1", fallbackValue = "", paramLabel = "BASE",
        description = "Seed the new store from BASE, or from the latest existing store if BASE is omitted")
    private String incremental;

    @Option(names = {"--target"}, description = "Write this store file in place instead of a new timestamped store")
    private Path target;

    @Option(names = {"--dry-run"}, description = "List the experiments that would be synced, without writing")
    private boolean dryRun;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        SyncSettings settings = parent.getSettings();
        SyncRequest.Builder builder = SyncRequest.builder(settings).incremental(incremental != null).targetStore(target);
        if (incremental != null && !incremental.isEmpty()) {
            builder.baseStore(Path.of(incremental));
        }
        if (hours != null) {
            builder.window(Duration.ofHours(hours));
        }
        if (exclude != null) {
            builder.exclude(exclude);
        }
        if (outputDir != null) {
            builder.outputDir(outputDir);
        }
        if (parallel != null) {
            builder.parallelism(parallel);
        }
        if (batchSize != null) {
            builder.batchSize(batchSize);
        }
        if (queueSize != null) {
            builder.queueCapacity(queueSize);
        }
        SyncRequest request = builder.build();

        SyncService service = new SyncService(settings, parent.createSource());
        PrintWriter out = spec.commandLine().getOut();
        if (dryRun) {
            Duration window = request.window() != null ? request.window() : service.defaultWindow(request);
            ChangeSet changeSet = service.resolve(window, request.exclude());
            changeSet.forEach(out::println);
            out.printf("Dry run: %d experiments would be synced (lookback %d hours)%n",
                changeSet.size(), window.toHours());
            out.flush();
            return CommandLineInterface.EXIT_OK;
        }

        RunSummary summary;
        try (ShutdownCancellation ignored = ShutdownCancellation.register(service)) {
            summary = service.sync(request);
        }
        RunSummaryPrinter.print(out, summary);
        return CommandLineInterface.EXIT_OK;
    }
}
