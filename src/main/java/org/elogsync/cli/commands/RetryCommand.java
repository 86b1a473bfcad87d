package org.elogsync.cli.commands;

import org.elogsync.cli.CommandLineInterface;
import org.elogsync.cli.RunSummaryPrinter;
import org.elogsync.cli.ShutdownCancellation;
import org.elogsync.config.SyncSettings;
import org.elogsync.pipeline.api.contracts.RunSummary;
import org.elogsync.pipeline.services.SyncService;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "retry",
    description = "Retries the experiments recorded in the failure ledger"
)
public class RetryCommand implements Callable<Integer> {

    @Option(names = {"-f", "--file"}, description = "Failure ledger (default: <output-dir>/failed_experiments.json)")
    private Path ledgerFile;

    @Option(names = {"-o", "--output-dir"}, description = "Directory holding the stores")
    private Path outputDir;

    @Option(names = {"-p", "--parallel"}, description = "Number of concurrent fetches")
    private Integer parallel;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        SyncSettings settings = parent.getSettings();
        Path dir = outputDir != null ? outputDir : settings.databaseDir();
        Path ledger = ledgerFile != null ? ledgerFile : settings.ledgerFile(dir);
        int parallelism = parallel != null ? parallel : settings.parallelism();

        SyncService service = new SyncService(settings, parent.createSource());
        RunSummary summary;
        try (ShutdownCancellation ignored = ShutdownCancellation.register(service)) {
            summary = service.retryFailed(ledger, dir, parallelism);
        }
        RunSummaryPrinter.print(spec.commandLine().getOut(), summary);
        return CommandLineInterface.EXIT_OK;
    }
}
