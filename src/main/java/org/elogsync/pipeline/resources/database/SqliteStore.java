package org.elogsync.pipeline.resources.database;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.elogsync.pipeline.resources.AbstractResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Map;
import java.util.Optional;

/**
 * Lifecycle of the SQLite store for one run.
 * <p>
 * {@link #open(Path)} switches the store into WAL mode so that readers can keep using it while
 * the run writes. {@link #close()} checkpoints the WAL and converts the store back to
 * {@code DELETE} journal mode, leaving a self-contained file without {@code -wal}/{@code -shm}
 * side files. The connection is owned by the batch writer; no other component writes through it.
 */
public class SqliteStore extends AbstractResource implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SqliteStore.class);

    public static final String META_LAST_UPDATE = "last_update";
    public static final String META_LAST_SUCCESSFUL_SYNC = "last_successful_sync";
    public static final String META_HOURS_LOOKBACK = "hours_lookback";

    private final long busyTimeoutMs;
    private final int cacheSize;

    private Connection connection;
    private Path path;

    /**
     * @param name    The resource name.
     * @param options Optional {@code busy-timeout} (duration) and {@code cache-size} (SQLite pragma value).
     */
    public SqliteStore(String name, Config options) {
        super(name, options);
        Config defaults = ConfigFactory.parseMap(Map.of(
            "busy-timeout", "5s",
            "cache-size", -64000
        ));
        Config finalConfig = options.withFallback(defaults);
        this.busyTimeoutMs = finalConfig.getDuration("busy-timeout").toMillis();
        this.cacheSize = finalConfig.getInt("cache-size");
    }

    /**
     * Opens (creating if necessary) the store at {@code path} in WAL mode and ensures the schema.
     *
     * @throws SQLException          if the database cannot be opened or the schema cannot be created
     * @throws IOException           if the parent directory cannot be created
     * @throws IllegalStateException if this store is already open
     */
    public void open(Path path) throws SQLException, IOException {
        if (connection != null) {
            throw new IllegalStateException("Store '" + resourceName + "' is already open at " + this.path);
        }
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        Connection conn = DriverManager.getConnection("jdbc:sqlite:" + path.toAbsolutePath());
        try {
            try (Statement st = conn.createStatement()) {
                st.execute("PRAGMA journal_mode=WAL");
                st.execute("PRAGMA synchronous=NORMAL");
                st.execute("PRAGMA busy_timeout=" + busyTimeoutMs);
                st.execute("PRAGMA cache_size=" + cacheSize);
            }
            StoreSchema.apply(conn);
        } catch (SQLException e) {
            log.error("Failed to open store {}: {}", path, e.getMessage());
            conn.close();
            throw e;
        }
        this.connection = conn;
        this.path = path;
        log.debug("Opened store {} in WAL mode", path);
    }

    /**
     * @return The writer connection
     * @throws IllegalStateException if the store is not open
     */
    public Connection connection() {
        if (connection == null) {
            throw new IllegalStateException("Store '" + resourceName + "' is not open");
        }
        return connection;
    }

    public Path path() {
        return path;
    }

    public boolean isOpen() {
        return connection != null;
    }

    /**
     * Writes one metadata value in its own transaction.
     */
    public void putMetadata(String key, String value) throws SQLException {
        try (PreparedStatement ps = connection().prepareStatement(SqliteBundleWriter.UPSERT_METADATA)) {
            ps.setString(1, key);
            ps.setString(2, value);
            ps.executeUpdate();
        }
    }

    public Optional<String> getMetadata(String key) throws SQLException {
        try (PreparedStatement ps = connection().prepareStatement("SELECT value FROM Metadata WHERE key = ?")) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
            }
        }
    }

    /**
     * @return The current journal mode as reported by SQLite (e.g. {@code wal}, {@code delete})
     */
    public String journalMode() throws SQLException {
        try (Statement st = connection().createStatement(); ResultSet rs = st.executeQuery("PRAGMA journal_mode")) {
            return rs.next() ? rs.getString(1) : "";
        }
    }

    /**
     * Checkpoints the WAL, converts the store to {@code DELETE} journal mode and closes the connection.
     * If the conversion fails (another process holds the store), the connection is still closed
     * and the next clean close repairs the journal mode.
     */
    @Override
    public void close() throws SQLException {
        if (connection == null) {
            return;
        }
        Connection conn = connection;
        connection = null;
        try {
            if (!conn.getAutoCommit()) {
                conn.rollback();
                conn.setAutoCommit(true);
            }
            try (Statement st = conn.createStatement()) {
                st.execute("PRAGMA wal_checkpoint(TRUNCATE)");
                st.execute("PRAGMA journal_mode=DELETE");
            }
            log.debug("Closed store {} in DELETE journal mode", path);
        } catch (SQLException e) {
            log.warn("Could not convert store {} to DELETE journal mode: {}", path, e.getMessage());
            recordError("JOURNAL_MODE_CONVERSION_FAILED", "Store left in WAL mode", path + ": " + e.getMessage());
        } finally {
            conn.close();
        }
    }

    /**
     * Closes the connection without checkpointing. Used when the connection is known to be unusable.
     */
    public void abandon() {
        if (connection == null) {
            return;
        }
        Connection conn = connection;
        connection = null;
        try {
            conn.close();
        } catch (SQLException e) {
            log.debug("Error while abandoning store {}: {}", path, e.getMessage());
        }
    }

    public long getBusyTimeoutMs() {
        return busyTimeoutMs;
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("open", connection != null ? 1 : 0);
    }
}
