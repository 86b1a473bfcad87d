package org.elogsync.cli.commands;

import org.elogsync.cli.CommandLineInterface;
import org.elogsync.cli.RunSummaryPrinter;
import org.elogsync.config.SyncSettings;
import org.elogsync.pipeline.api.contracts.RunSummary;
import org.elogsync.pipeline.services.SyncService;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "fetch",
    description = "Fetches a single experiment into the latest store"
)
public class FetchCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Experiment identifier, e.g. mfxl1033223")
    private String experiment;

    @Option(names = {"-o", "--output-dir"}, description = "Directory holding the stores")
    private Path outputDir;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        SyncSettings settings = parent.getSettings();
        Path dir = outputDir != null ? outputDir : settings.databaseDir();
        RunSummary summary = new SyncService(settings, parent.createSource()).fetch(experiment, dir);
        RunSummaryPrinter.print(spec.commandLine().getOut(), summary);
        return CommandLineInterface.EXIT_OK;
    }
}
