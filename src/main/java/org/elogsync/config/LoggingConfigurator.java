package org.elogsync.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.util.Map;

/**
 * Applies the {@code logging} block of the configuration to Logback at runtime.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * logging {
 *   format = "PLAIN"        # "PLAIN" or "JSON"
 *   default-level = "INFO"  # root logger level
 *   levels {
 *     "org.elogsync.pipeline.resources.source" = "DEBUG"
 *   }
 * }
 * </pre>
 * The format selects the console appender in {@code logback.xml} through the
 * {@value #FORMAT_PROPERTY} property.
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);

    public static final String FORMAT_PROPERTY = "elogsync.logging.format";
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String FORMAT_KEY = "format";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";

    private static boolean loggingConfigured = false;

    private LoggingConfigurator() {
    }

    /**
     * Configures logging from the given configuration. Idempotent until {@link #reset()}.
     *
     * @param config        The application configuration
     * @param levelOverride Root level forced by the command line ({@code -v}/{@code -q}), or {@code null}
     */
    public static synchronized void configure(Config config, Level levelOverride) {
        if (loggingConfigured) {
            LOGGER.debug("Logging already configured, skipping.");
            return;
        }
        loggingConfigured = true;

        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        if (config.hasPath(LOGGING_CONFIG_PATH)) {
            Config loggingConfig = config.getConfig(LOGGING_CONFIG_PATH);
            if (configureFormat(loggingConfig, context)) {
                reconfigureLogback(context);
            }
            configureDefaultLevel(loggingConfig, context);
            configureSpecificLevels(loggingConfig, context);
        }
        if (levelOverride != null) {
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(levelOverride);
            LOGGER.debug("Root log level forced to {}", levelOverride);
        }
    }

    /**
     * @return true if the selected appender differs from the one Logback started with
     */
    private static boolean configureFormat(Config loggingConfig, LoggerContext context) {
        String format = loggingConfig.hasPath(FORMAT_KEY) ? loggingConfig.getString(FORMAT_KEY) : "PLAIN";
        String appender = "JSON".equalsIgnoreCase(format) ? "STDOUT" : "STDOUT_PLAIN";
        String previous = System.getProperty(FORMAT_PROPERTY, "STDOUT_PLAIN");
        context.putProperty(FORMAT_PROPERTY, appender);
        System.setProperty(FORMAT_PROPERTY, appender);
        return !appender.equals(previous);
    }

    private static void reconfigureLogback(LoggerContext context) {
        URL configUrl = LoggingConfigurator.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    private static void configureDefaultLevel(Config loggingConfig, LoggerContext context) {
        if (loggingConfig.hasPath(DEFAULT_LEVEL_KEY)) {
            Level level = Level.toLevel(loggingConfig.getString(DEFAULT_LEVEL_KEY), Level.INFO);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
            LOGGER.debug("Configured default log level: {}", level);
        }
    }

    private static void configureSpecificLevels(Config loggingConfig, LoggerContext context) {
        if (!loggingConfig.hasPath(LEVELS_KEY)) {
            return;
        }
        Config levelsConfig = loggingConfig.getConfig(LEVELS_KEY);
        for (Map.Entry<String, ConfigValue> entry : levelsConfig.root().entrySet()) {
            String loggerName = entry.getKey();
            String levelName = String.valueOf(entry.getValue().unwrapped());
            Level level = Level.toLevel(levelName, null);
            if (level == null) {
                LOGGER.warn("Ignoring unknown log level '{}' for logger '{}'", levelName, loggerName);
                continue;
            }
            context.getLogger(loggerName).setLevel(level);
            LOGGER.debug("Configured logger '{}' to level: {}", loggerName, level);
        }
    }

    /**
     * Resets the configured flag. Used by tests.
     */
    public static synchronized void reset() {
        loggingConfigured = false;
    }
}
