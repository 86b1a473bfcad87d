package org.elogsync.pipeline.resources.database;

import org.sqlite.SQLiteConfig;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only access to an existing store, used for status reports and to bound incremental windows.
 * Never takes the store lock.
 */
public class StoreReader implements AutoCloseable {

    private final Path path;
    private final Connection connection;

    private StoreReader(Path path, Connection connection) {
        this.path = path;
        this.connection = connection;
    }

    /**
     * Opens the store read-only.
     *
     * @throws SQLException if the file does not exist or is not a SQLite database
     */
    public static StoreReader open(Path path) throws SQLException {
        if (!Files.isRegularFile(path)) {
            throw new SQLException("Store does not exist: " + path);
        }
        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(true);
        Connection conn = DriverManager.getConnection("jdbc:sqlite:" + path.toAbsolutePath(), config.toProperties());
        return new StoreReader(path, conn);
    }

    public Path path() {
        return path;
    }

    /**
     * @return The metadata value, or empty if the key (or the whole table) is missing
     */
    public Optional<String> metadata(String key) throws SQLException {
        if (!tableExists("Metadata")) {
            return Optional.empty();
        }
        try (PreparedStatement ps = connection.prepareStatement("SELECT value FROM Metadata WHERE key = ?")) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
            }
        }
    }

    /**
     * @return Row count per store table, in schema order. Missing tables are skipped.
     */
    public Map<String, Long> rowCounts() throws SQLException {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (String table : StoreSchema.TABLES) {
            if (!tableExists(table)) {
                continue;
            }
            try (Statement st = connection.createStatement();
                 ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + table)) {
                counts.put(table, rs.next() ? rs.getLong(1) : 0L);
            }
        }
        return counts;
    }

    private boolean tableExists(String table) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(
                "SELECT 1 FROM sqlite_master WHERE type = 'table' AND name = ?")) {
            ps.setString(1, table);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    @Override
    public void close() throws SQLException {
        connection.close();
    }
}
