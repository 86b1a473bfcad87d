package org.elogsync.pipeline.api.resources;

import org.elogsync.pipeline.api.contracts.RecordBundle;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;

/**
 * Writes batches of record bundles into the store.
 * <p>
 * Each call is one transaction: either every row of every bundle plus the metadata update
 * become visible, or none do.
 */
public interface IBundleWriter {

    /**
     * Upserts the given bundles and records {@code committedAt} as the last update time.
     *
     * @param bundles     Bundles to write, one per experiment.
     * @param committedAt Timestamp stored in the metadata table.
     * @throws SQLException if any statement fails. The transaction is rolled back before this is thrown.
     */
    void writeBatch(List<RecordBundle> bundles, Instant committedAt) throws SQLException;
}
