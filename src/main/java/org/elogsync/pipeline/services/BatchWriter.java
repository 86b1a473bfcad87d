package org.elogsync.pipeline.services;

import org.elogsync.pipeline.api.contracts.ErrorKind;
import org.elogsync.pipeline.api.contracts.FetchResult;
import org.elogsync.pipeline.api.contracts.RecordBundle;
import org.elogsync.pipeline.api.resources.IBundleWriter;
import org.elogsync.pipeline.resources.ledger.FailureLedger;
import org.elogsync.pipeline.resources.queues.BoundedResultQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Single consumer of the fetch result stream. Groups successful bundles into batches and
 * commits each batch in one transaction; failures go to the failure ledger.
 * <p>
 * A batch that cannot be committed is rolled back as a whole and every experiment in it is
 * recorded as a {@link ErrorKind#PERSISTENCE} failure. The run continues with the next batch.
 * After {@code maxConsecutiveFailures} rolled-back batches in a row the store is considered
 * unusable: the {@code onFatal} callback is invoked once and all remaining successes are recorded
 * as persistence failures without further write attempts.
 * <p>
 * Not thread-safe. One instance per run.
 */
public class BatchWriter {

    private static final Logger log = LoggerFactory.getLogger(BatchWriter.class);

    public static final int DEFAULT_MAX_CONSECUTIVE_FAILURES = 3;

    private final IBundleWriter writer;
    private final int batchSize;
    private final FailureLedger ledger;
    private final Clock clock;
    private final int maxConsecutiveFailures;
    private final Runnable onFatal;

    private final Set<String> committed = new LinkedHashSet<>();
    private int batchesCommitted = 0;
    private int batchesRolledBack = 0;
    private int consecutiveFailures = 0;
    private boolean fatal = false;

    public BatchWriter(IBundleWriter writer, int batchSize, FailureLedger ledger, Clock clock, Runnable onFatal) {
        this(writer, batchSize, ledger, clock, onFatal, DEFAULT_MAX_CONSECUTIVE_FAILURES);
    }

    public BatchWriter(IBundleWriter writer, int batchSize, FailureLedger ledger, Clock clock,
                       Runnable onFatal, int maxConsecutiveFailures) {
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
        this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.onFatal = onFatal != null ? onFatal : () -> { };
        if (batchSize < 1) {
            throw new IllegalArgumentException("batch size must be at least 1, got " + batchSize);
        }
        if (maxConsecutiveFailures < 1) {
            throw new IllegalArgumentException("maxConsecutiveFailures must be at least 1");
        }
        this.batchSize = batchSize;
        this.maxConsecutiveFailures = maxConsecutiveFailures;
    }

    /**
     * Consumes the stream until its end, committing full batches as they fill and the remainder
     * at the end. Interrupts do not stop consumption, so no delivered result is lost; the
     * interrupt flag is restored on return.
     *
     * @return Outcome of all write attempts
     */
    public Outcome consume(BoundedResultQueue<FetchResult> results) {
        List<FetchResult.Success> batch = new ArrayList<>(batchSize);
        boolean interrupted = false;
        while (true) {
            Optional<FetchResult> next;
            try {
                next = results.take();
            } catch (InterruptedException e) {
                interrupted = true;
                continue;
            }
            if (next.isEmpty()) {
                break;
            }
            FetchResult result = next.get();
            if (result instanceof FetchResult.Success success) {
                batch.add(success);
                if (batch.size() >= batchSize) {
                    commit(batch);
                    batch = new ArrayList<>(batchSize);
                }
            } else if (result instanceof FetchResult.Failure failure) {
                ledger.record(failure);
            }
        }
        if (!batch.isEmpty()) {
            commit(batch);
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return new Outcome(Collections.unmodifiableSet(new LinkedHashSet<>(committed)),
            batchesCommitted, batchesRolledBack, fatal);
    }

    private void commit(List<FetchResult.Success> batch) {
        if (fatal) {
            for (FetchResult.Success success : batch) {
                ledger.record(new FetchResult.Failure(success.identifier(), ErrorKind.PERSISTENCE,
                    "Not written: store unavailable after repeated commit failures", success.attempts()));
            }
            return;
        }
        List<RecordBundle> bundles = new ArrayList<>(batch.size());
        for (FetchResult.Success success : batch) {
            bundles.add(success.bundle());
        }
        try {
            writer.writeBatch(bundles, clock.instant());
            for (FetchResult.Success success : batch) {
                committed.add(success.identifier());
            }
            batchesCommitted++;
            consecutiveFailures = 0;
            log.debug("Committed batch of {} experiments ({} total)", batch.size(), committed.size());
        } catch (SQLException | RuntimeException e) {
            batchesRolledBack++;
            consecutiveFailures++;
            String reason = e.getClass().getSimpleName() + ": " + e.getMessage();
            log.warn("Rolled back batch of {} experiments: {}", batch.size(), reason);
            log.debug("Batch commit failure:", e);
            for (FetchResult.Success success : batch) {
                ledger.record(new FetchResult.Failure(success.identifier(), ErrorKind.PERSISTENCE,
                    reason, success.attempts()));
            }
            if (consecutiveFailures >= maxConsecutiveFailures) {
                fatal = true;
                log.error("Store failed {} consecutive commits, stopping writes", consecutiveFailures);
                onFatal.run();
            }
        }
    }

    /**
     * @param committed         Identifiers whose bundles are durably in the store
     * @param batchesCommitted  Number of committed transactions
     * @param batchesRolledBack Number of rolled-back transactions
     * @param fatal             Whether writing was abandoned after repeated failures
     */
    public record Outcome(Set<String> committed, int batchesCommitted, int batchesRolledBack, boolean fatal) {
    }
}
