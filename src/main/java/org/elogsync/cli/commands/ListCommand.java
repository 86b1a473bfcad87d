package org.elogsync.cli.commands;

import org.elogsync.cli.CommandLineInterface;
import org.elogsync.config.SyncSettings;
import org.elogsync.pipeline.api.contracts.ChangeSet;
import org.elogsync.pipeline.services.SyncService;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "list",
    description = "Lists experiments updated within the lookback window"
)
public class ListCommand implements Callable<Integer> {

    @Option(names = {"-H", "--hours"}, description = "Lookback window in hours (default: configured lookback)")
    private Long hours;

    @Option(names = {"-e", "--exclude"}, description = "Exclude experiments matching this pattern (repeatable)")
    private List<String> exclude;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        SyncSettings settings = parent.getSettings();
        Duration window = hours != null ? Duration.ofHours(hours) : settings.lookback();
        List<String> patterns = exclude != null ? exclude : settings.exclude();

        ChangeSet changeSet = new SyncService(settings, parent.createSource()).resolve(window, patterns);
        PrintWriter out = spec.commandLine().getOut();
        changeSet.forEach(out::println);
        out.printf("%d experiments updated in the last %d hours%n", changeSet.size(), window.toHours());
        out.flush();
        return CommandLineInterface.EXIT_OK;
    }
}
