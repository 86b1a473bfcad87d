package org.elogsync.cli;

import ch.qos.logback.classic.Level;
import com.typesafe.config.Config;
import org.elogsync.cli.commands.FetchCommand;
import org.elogsync.cli.commands.ListCommand;
import org.elogsync.cli.commands.RetryCommand;
import org.elogsync.cli.commands.StatusCommand;
import org.elogsync.cli.commands.SyncCommand;
import org.elogsync.config.ConfigLoader;
import org.elogsync.config.LoggingConfigurator;
import org.elogsync.config.SyncSettings;
import org.elogsync.pipeline.api.source.IRemoteSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "elogsync",
    mixinStandardHelpOptions = true,
    version = "elogsync 1.0",
    description = "Incrementally synchronizes experiment elog data into a local SQLite database",
    subcommands = {
        SyncCommand.class,
        RetryCommand.class,
        FetchCommand.class,
        StatusCommand.class,
        ListCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CommandLineInterface.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_ABORTED = 1;

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: elogsync.conf)"
    )
    private File configFile;

    @Option(names = {"-v", "--verbose"}, description = "Log at DEBUG level")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Log errors only")
    private boolean quiet;

    private Config config;
    private SyncSettings settings;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return EXIT_OK;
    }

    public static void main(final String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * Creates the command line with the exit code mapping: run-level errors thrown by a command
     * are reported on stderr and exit with {@link #EXIT_ABORTED}.
     */
    public static CommandLine createCommandLine() {
        CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("elogsync");
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            log.error("{}", ex.getMessage());
            log.debug("Command failed:", ex);
            cmd.getErr().println("Error: " + ex.getMessage());
            return EXIT_ABORTED;
        });
        return commandLine;
    }

    private void initialize() {
        config = ConfigLoader.load(configFile);
        Level override = verbose ? Level.DEBUG : quiet ? Level.ERROR : null;
        LoggingConfigurator.configure(config, override);
        settings = SyncSettings.from(config);
    }

    public Config getConfig() {
        if (config == null) {
            initialize();
        }
        return config;
    }

    public SyncSettings getSettings() {
        if (settings == null) {
            initialize();
        }
        return settings;
    }

    /**
     * Creates the remote source configured under {@code elogsync.source}.
     */
    public IRemoteSource createSource() {
        return SourceFactory.create("elog-source", IRemoteSource.class, getSettings().source());
    }
}
