package org.elogsync.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the application configuration, respecting this precedence (first wins):
 * <ol>
 *   <li>Java system properties ({@code -Dkey=value})</li>
 *   <li>Environment variables</li>
 *   <li>The configuration file: {@code --config}, else {@code -Dconfig.file}, else
 *       {@code elogsync.conf} in the working directory</li>
 *   <li>Defaults from {@code reference.conf} on the classpath</li>
 * </ol>
 * Selected environment variables ({@code ELOGSYNC_*}) are also mapped onto settings by optional
 * substitutions in {@code reference.conf}.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    public static final String CONFIG_FILE_NAME = "elogsync.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * @param explicitFile File given on the command line, or {@code null}
     * @return The resolved configuration
     * @throws ConfigException if a named file does not exist or any file cannot be parsed
     */
    public static Config load(File explicitFile) {
        File configFile = selectFile(explicitFile);
        Config fileConfig;
        if (configFile != null) {
            LOG.debug("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("No '{}' found, using default configuration from classpath", CONFIG_FILE_NAME);
            fileConfig = ConfigFactory.empty();
        }

        // Chain the configs together. The one provided first wins.
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(fileConfig)
            .withFallback(ConfigFactory.defaultReference())
            .resolve();
    }

    private static File selectFile(File explicitFile) {
        if (explicitFile != null) {
            return requireExisting(explicitFile, "--config");
        }
        String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            return requireExisting(new File(systemConfigPath).getAbsoluteFile(), "-Dconfig.file");
        }
        File cwdConfigFile = new File(CONFIG_FILE_NAME);
        return cwdConfigFile.isFile() ? cwdConfigFile : null;
    }

    private static File requireExisting(File file, String origin) {
        if (!file.isFile()) {
            throw new ConfigException.Generic(
                "Configuration file specified via " + origin + " was not found: " + file.getAbsolutePath());
        }
        return file;
    }
}
