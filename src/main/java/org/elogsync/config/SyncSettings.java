package org.elogsync.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.elogsync.pipeline.resources.retry.RetryPolicy;
import org.elogsync.pipeline.utils.PathExpansion;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Validated, immutable view of the {@code elogsync} configuration block.
 *
 * @param source             The {@code source} block ({@code className} and {@code options})
 * @param lookback           Default lookback window
 * @param exclude            Default exclude patterns
 * @param parallelism        Concurrent fetches
 * @param batchSize          Experiments per transaction
 * @param queueCapacity      Fetched but unwritten results held in memory
 * @param databaseDir        Directory holding the stores, lock and ledger
 * @param incrementalOverlap Added to the time since the last successful sync in incremental mode
 * @param retryPolicy        Retry policy of the entity fetcher
 * @param storePrefix        Store file name prefix
 * @param lockFileName       Lock file name inside {@code databaseDir}
 * @param storeOptions       Options of the SQLite store ({@code busy-timeout}, {@code cache-size})
 * @param ledgerFileName     Failure ledger file name inside {@code databaseDir}
 */
public record SyncSettings(
    Config source,
    Duration lookback,
    List<String> exclude,
    int parallelism,
    int batchSize,
    int queueCapacity,
    Path databaseDir,
    Duration incrementalOverlap,
    RetryPolicy retryPolicy,
    String storePrefix,
    String lockFileName,
    Config storeOptions,
    String ledgerFileName
) {

    public static final String ROOT_PATH = "elogsync";

    public SyncSettings {
        exclude = List.copyOf(exclude);
        requirePositive("sync.parallelism", parallelism);
        requirePositive("sync.batch-size", batchSize);
        requirePositive("sync.queue-capacity", queueCapacity);
        if (lookback.isNegative()) {
            throw new ConfigException.BadValue("sync.lookback", "must not be negative");
        }
        if (storePrefix.isBlank()) {
            throw new ConfigException.BadValue("store.prefix", "must not be blank");
        }
    }

    /**
     * Reads and validates the {@code elogsync} block of a resolved application configuration.
     *
     * @throws ConfigException if a setting is missing or invalid
     */
    public static SyncSettings from(Config root) {
        Config c = root.getConfig(ROOT_PATH);
        Config sync = c.getConfig("sync");
        Config retry = c.getConfig("retry");
        Config store = c.getConfig("store");

        int maxAttempts = retry.getInt("max-attempts");
        requirePositive("retry.max-attempts", maxAttempts);
        RetryPolicy policy;
        try {
            policy = new RetryPolicy(maxAttempts, retry.getDuration("base-delay"),
                retry.getDuration("max-delay"), retry.getDouble("jitter"));
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue("retry", e.getMessage());
        }

        Config storeOptions = ConfigFactory.parseMap(Map.of(
            "busy-timeout", store.getString("busy-timeout"),
            "cache-size", store.getInt("cache-size")));

        return new SyncSettings(
            c.getConfig("source"),
            sync.getDuration("lookback"),
            sync.getStringList("exclude"),
            sync.getInt("parallelism"),
            sync.getInt("batch-size"),
            sync.getInt("queue-capacity"),
            PathExpansion.toPath(sync.getString("database-dir")),
            sync.getDuration("incremental-overlap"),
            policy,
            store.getString("prefix"),
            store.getString("lock-file"),
            storeOptions,
            c.getString("ledger.file-name"));
    }

    public Path lockFile(Path directory) {
        return directory.resolve(lockFileName);
    }

    public Path ledgerFile(Path directory) {
        return directory.resolve(ledgerFileName);
    }

    private static void requirePositive(String key, int value) {
        if (value < 1) {
            throw new ConfigException.BadValue(key, "must be at least 1, got " + value);
        }
    }
}
