package org.elogsync.pipeline.services;

import org.elogsync.config.SyncSettings;
import org.elogsync.pipeline.api.contracts.ChangeSet;
import org.elogsync.pipeline.api.contracts.FetchResult;
import org.elogsync.pipeline.api.contracts.LedgerEntry;
import org.elogsync.pipeline.api.contracts.RunSummary;
import org.elogsync.pipeline.api.resources.AlreadyRunningException;
import org.elogsync.pipeline.api.resources.CorruptLedgerException;
import org.elogsync.pipeline.api.resources.IResource;
import org.elogsync.pipeline.api.resources.IStoreLock;
import org.elogsync.pipeline.api.resources.ResourceStatus;
import org.elogsync.pipeline.api.resources.StoreUnavailableException;
import org.elogsync.pipeline.api.resources.SyncException;
import org.elogsync.pipeline.api.source.IRemoteSource;
import org.elogsync.pipeline.api.source.SourceUnavailableException;
import org.elogsync.pipeline.resources.database.SqliteBundleWriter;
import org.elogsync.pipeline.resources.database.SqliteStore;
import org.elogsync.pipeline.resources.database.StoreNaming;
import org.elogsync.pipeline.resources.database.StoreReader;
import org.elogsync.pipeline.resources.ledger.FailureLedger;
import org.elogsync.pipeline.resources.lock.FileStoreLock;
import org.elogsync.pipeline.resources.queues.BoundedResultQueue;
import org.elogsync.pipeline.utils.ExcludePatterns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Orchestrates sync runs: resolve the change set, take the directory lock, prepare the store,
 * fetch and write, then close the store portably and flush the failure ledger.
 * <p>
 * Run-level failures ({@link SourceUnavailableException}, {@link AlreadyRunningException},
 * {@link CorruptLedgerException}, {@link StoreUnavailableException}) abort before anything is
 * written. Per-experiment failures never abort a run; they end up in the ledger and the
 * {@link RunSummary}.
 * <p>
 * Store selection:
 * <ul>
 *   <li>{@code sync} with a target store writes that file in place.</li>
 *   <li>{@code sync} without a target writes a new timestamped store; incremental runs seed it with
 *       a copy of the requested base store, or of the latest existing store.</li>
 *   <li>{@code retryFailed} and {@code fetch} write the latest store in place, or a new one if the
 *       directory has none.</li>
 * </ul>
 * Only {@code sync} records {@code last_successful_sync}, which bounds the next incremental window.
 * The failure ledger is rewritten by {@code sync} and {@code retryFailed}: entries of an earlier
 * ledger are kept unless their experiment was part of the run. {@code fetch} never touches it.
 */
public class SyncService {

    private static final Logger log = LoggerFactory.getLogger(SyncService.class);

    private final SyncSettings settings;
    private final IRemoteSource source;
    private final IStoreLock storeLock;
    private final Clock clock;

    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private volatile FetchScheduler activeScheduler;
    private volatile CountDownLatch runFinished = new CountDownLatch(0);

    public SyncService(SyncSettings settings, IRemoteSource source) {
        this(settings, source, new FileStoreLock(), Clock.systemDefaultZone());
    }

    public SyncService(SyncSettings settings, IRemoteSource source, IStoreLock storeLock, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.storeLock = Objects.requireNonNull(storeLock, "storeLock must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Resolves the change set for a window without locking or writing anything.
     */
    public ChangeSet resolve(Duration window, List<String> exclude)
            throws SourceUnavailableException, InterruptedException {
        return new ChangeSetResolver(source).resolve(window, ExcludePatterns.of(exclude));
    }

    /**
     * Runs one sync.
     *
     * @return Summary of the run; failures are reported here, not thrown
     * @throws SyncException        on a run-level abort
     * @throws InterruptedException if interrupted while the change set is being resolved
     */
    public RunSummary sync(SyncRequest request) throws SyncException, InterruptedException {
        CountDownLatch finished = beginRun();
        try {
            source.checkCredentials();
            Path dir = request.outputDir().toAbsolutePath().normalize();
            IStoreLock.Lease lease = acquireLock(dir);
            try {
                Path ledgerFile = settings.ledgerFile(dir);
                List<LedgerEntry> previousFailures = FailureLedger.loadIfExists(ledgerFile);
                Optional<Path> base = request.incremental() ? incrementalBase(request, dir) : Optional.empty();
                Duration window = request.window() != null
                    ? request.window()
                    : request.incremental() ? windowSinceLastSync(base) : settings.lookback();
                ChangeSet changeSet = resolve(window, request.exclude());
                Path storePath = prepareStore(request, dir, base);
                log.info("Syncing {} experiments into {} (parallelism {}, batch size {})",
                    changeSet.size(), storePath, request.parallelism(), request.batchSize());
                return execute(new RunPlan(changeSet, storePath, ledgerFile, previousFailures,
                    request.parallelism(), request.batchSize(), request.queueCapacity(), window, true));
            } finally {
                release(lease);
            }
        } finally {
            finished.countDown();
        }
    }

    /**
     * Retries the experiments listed in a failure ledger. On full success the ledger file is
     * deleted; otherwise it is rewritten with the experiments that still fail.
     *
     * @param ledgerPath  The ledger to resume
     * @param outputDir   Directory holding the stores
     * @param parallelism Concurrent fetches
     * @throws CorruptLedgerException if the ledger cannot be read
     * @throws SyncException          on any other run-level abort
     */
    public RunSummary retryFailed(Path ledgerPath, Path outputDir, int parallelism) throws SyncException {
        CountDownLatch finished = beginRun();
        try {
            ChangeSet changeSet = FailureLedger.loadChangeSet(ledgerPath);
            source.checkCredentials();
            Path dir = outputDir.toAbsolutePath().normalize();
            IStoreLock.Lease lease = acquireLock(dir);
            try {
                Path storePath = latestOrNewStore(dir);
                log.info("Retrying {} failed experiments from {} into {}", changeSet.size(), ledgerPath, storePath);
                return execute(new RunPlan(changeSet, storePath, ledgerPath, List.of(), parallelism,
                    settings.batchSize(), settings.queueCapacity(), null, false));
            } finally {
                release(lease);
            }
        } finally {
            finished.countDown();
        }
    }

    /**
     * Retries a ledger stored next to the stores, with the configured parallelism.
     */
    public RunSummary retryFailed(Path ledgerPath) throws SyncException {
        Path dir = ledgerPath.toAbsolutePath().getParent();
        return retryFailed(ledgerPath, dir, settings.parallelism());
    }

    /**
     * Fetches a single experiment into the latest store. The failure ledger is left untouched; a
     * failure is only reported in the summary.
     */
    public RunSummary fetch(String experimentId, Path outputDir) throws SyncException {
        CountDownLatch finished = beginRun();
        try {
            ChangeSet changeSet = ChangeSet.of(experimentId);
            source.checkCredentials();
            Path dir = outputDir.toAbsolutePath().normalize();
            IStoreLock.Lease lease = acquireLock(dir);
            try {
                Path storePath = latestOrNewStore(dir);
                return execute(new RunPlan(changeSet, storePath, null, List.of(), 1, 1, 1, null, false));
            } finally {
                release(lease);
            }
        } finally {
            finished.countDown();
        }
    }

    /**
     * Requests cancellation of the active run: no new fetches are dispatched, in-flight fetches are
     * written, and undispatched experiments are recorded as cancelled. Idempotent.
     */
    public void cancel() {
        cancelRequested.set(true);
        FetchScheduler scheduler = activeScheduler;
        if (scheduler != null) {
            scheduler.cancel();
        }
    }

    /**
     * Waits for the active run, if any, to close its store and flush its ledger.
     *
     * @return true if no run is active when this returns
     */
    public boolean awaitRunFinished(Duration timeout) throws InterruptedException {
        return runFinished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private CountDownLatch beginRun() {
        CountDownLatch latch = new CountDownLatch(1);
        runFinished = latch;
        return latch;
    }

    /**
     * Lookback window for a sync without an explicit window. Incremental runs cover the time since
     * the latest store's last successful sync plus the configured overlap.
     */
    public Duration defaultWindow(boolean incremental, Path dir) {
        if (!incremental) {
            return settings.lookback();
        }
        return windowSinceLastSync(latestStore(dir));
    }

    /**
     * Lookback window the given request would use if it sets no explicit window.
     *
     * @throws StoreUnavailableException if the request names a base store that does not exist
     */
    public Duration defaultWindow(SyncRequest request) throws StoreUnavailableException {
        if (!request.incremental()) {
            return settings.lookback();
        }
        Path dir = request.outputDir().toAbsolutePath().normalize();
        return windowSinceLastSync(incrementalBase(request, dir));
    }

    private Duration windowSinceLastSync(Optional<Path> base) {
        Optional<Instant> lastSync = base.flatMap(this::lastSuccessfulSync);
        if (lastSync.isEmpty()) {
            log.info("No previous successful sync found, using the default lookback of {} hours",
                settings.lookback().toHours());
            return settings.lookback();
        }
        Duration since = Duration.between(lastSync.get(), clock.instant());
        if (since.isNegative()) {
            since = Duration.ZERO;
        }
        Duration window = since.plus(settings.incrementalOverlap());
        log.info("Last successful sync at {}, lookback {} minutes", lastSync.get(), window.toMinutes());
        return window;
    }

    private Optional<Path> latestStore(Path dir) {
        try {
            return naming().findLatest(dir);
        } catch (IOException e) {
            log.warn("Cannot list stores in {}: {}", dir, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<Path> incrementalBase(SyncRequest request, Path dir) throws StoreUnavailableException {
        if (request.baseStore() == null) {
            return latestStore(dir);
        }
        Path base = request.baseStore().toAbsolutePath().normalize();
        if (!Files.isRegularFile(base)) {
            throw new StoreUnavailableException(base, "base store not found");
        }
        return Optional.of(base);
    }

    private Optional<Instant> lastSuccessfulSync(Path store) {
        try (StoreReader reader = StoreReader.open(store)) {
            return reader.metadata(SqliteStore.META_LAST_SUCCESSFUL_SYNC).map(Instant::parse);
        } catch (SQLException | DateTimeParseException e) {
            log.warn("Cannot read last successful sync from {}: {}", store, e.getMessage());
            return Optional.empty();
        }
    }

    private IStoreLock.Lease acquireLock(Path dir) throws SyncException {
        try {
            Files.createDirectories(dir);
            return storeLock.acquire(settings.lockFile(dir), false);
        } catch (AlreadyRunningException e) {
            log.error("{}", e.getMessage());
            throw e;
        } catch (IOException e) {
            throw new StoreUnavailableException(settings.lockFile(dir), e);
        }
    }

    private void release(IStoreLock.Lease lease) {
        try {
            lease.close();
        } catch (IOException e) {
            log.warn("Failed to release lock {}: {}", lease.lockFile(), e.getMessage());
        }
    }

    private StoreNaming naming() {
        return new StoreNaming(settings.storePrefix(), clock);
    }

    private Path prepareStore(SyncRequest request, Path dir, Optional<Path> base) throws StoreUnavailableException {
        if (request.targetStore() != null) {
            return request.targetStore().toAbsolutePath().normalize();
        }
        Path newStore = naming().newStorePath(dir);
        if (Files.exists(newStore)) {
            log.warn("Store {} already exists, writing it in place", newStore.getFileName());
            return newStore;
        }
        if (base.isEmpty()) {
            return newStore;
        }
        try {
            repairJournal(base.get());
            Files.copy(base.get(), newStore);
            log.info("Seeded {} from {}", newStore.getFileName(), base.get());
        } catch (IOException | SQLException e) {
            throw new StoreUnavailableException(newStore, e);
        }
        return newStore;
    }

    private Path latestOrNewStore(Path dir) throws StoreUnavailableException {
        StoreNaming naming = naming();
        try {
            Optional<Path> latest = naming.findLatest(dir);
            return latest.isPresent() ? latest.get() : naming.newStorePath(dir);
        } catch (IOException e) {
            throw new StoreUnavailableException(dir, e);
        }
    }

    /**
     * A store left in WAL mode by an interrupted run keeps committed data in its side file.
     * Opening and closing it folds that data back before the store is copied.
     */
    private void repairJournal(Path store) throws IOException, SQLException {
        Path wal = store.resolveSibling(store.getFileName() + "-wal");
        if (!Files.exists(wal)) {
            return;
        }
        log.info("Store {} was not closed cleanly, checkpointing before copy", store.getFileName());
        SqliteStore repair = new SqliteStore("repair", settings.storeOptions());
        repair.open(store);
        repair.close();
    }

    /**
     * What one run fetches and where it writes.
     *
     * @param ledgerPath       Ledger to rewrite, or {@code null} to leave the ledger alone
     * @param previousFailures Entries of the existing ledger, kept unless their experiment is in the change set
     * @param window           Lookback window to record, or {@code null}
     * @param recordsSync      Whether a clean finish counts as a successful sync
     */
    private record RunPlan(ChangeSet changeSet, Path storePath, Path ledgerPath, List<LedgerEntry> previousFailures,
                           int parallelism, int batchSize, int queueCapacity, Duration window,
                           boolean recordsSync) {
    }

    private RunSummary execute(RunPlan plan) throws SyncException {
        Path storePath = plan.storePath();
        SqliteStore store = new SqliteStore("store", settings.storeOptions());
        try {
            store.open(storePath);
        } catch (SQLException | IOException e) {
            throw new StoreUnavailableException(storePath, e);
        }

        FailureLedger ledger = new FailureLedger(clock);
        int carried = ledger.carryOver(plan.previousFailures(), plan.changeSet());
        if (carried > 0) {
            log.info("Keeping {} failed experiments of the previous ledger that are not part of this run", carried);
        }
        FetchScheduler scheduler = new FetchScheduler(
            new EntityFetcher(source, settings.retryPolicy()), plan.parallelism(), plan.queueCapacity());
        BatchWriter writer = new BatchWriter(new SqliteBundleWriter(store), plan.batchSize(), ledger, clock,
            scheduler::cancel);

        activeScheduler = scheduler;
        if (cancelRequested.get()) {
            scheduler.cancel();
        }
        BoundedResultQueue<FetchResult> results;
        BatchWriter.Outcome outcome;
        boolean cancelled;
        try {
            results = scheduler.start(plan.changeSet());
            outcome = writer.consume(results);
            cancelled = cancelRequested.get() || scheduler.isCancelled();
            writeRunMetadata(store, plan.window(), plan.recordsSync() && !cancelled && !outcome.fatal());
            store.close();
        } catch (SQLException e) {
            store.abandon();
            throw new StoreUnavailableException(storePath, e);
        } catch (RuntimeException e) {
            store.abandon();
            throw e;
        } finally {
            activeScheduler = null;
        }

        Path ledgerPath = plan.ledgerPath();
        Path writtenLedger = null;
        if (ledgerPath != null) {
            try {
                if (ledger.flush(ledgerPath)) {
                    writtenLedger = ledgerPath;
                }
            } catch (IOException e) {
                log.error("Failed to write failure ledger {}: {}", ledgerPath, e.getMessage());
                throw new SyncException("Failed to write failure ledger " + ledgerPath, e);
            }
        }

        RunSummary summary = new RunSummary(outcome.committed().size(), ledger.entries(), storePath,
            writtenLedger, cancelled, resourceStatuses(store, results));
        if (summary.failed() > 0) {
            log.warn("Run finished with {} committed and {} failed experiments{}", summary.committed(),
                summary.failed(), writtenLedger != null ? ", see " + writtenLedger : "");
        } else {
            log.info("Run finished: {} experiments committed to {}", summary.committed(), storePath);
        }
        return summary;
    }

    private List<ResourceStatus> resourceStatuses(SqliteStore store, BoundedResultQueue<FetchResult> results) {
        List<ResourceStatus> statuses = new ArrayList<>();
        statuses.add(ResourceStatus.of(source));
        statuses.add(ResourceStatus.of(results));
        statuses.add(ResourceStatus.of(store));
        if (storeLock instanceof IResource lockResource) {
            statuses.add(ResourceStatus.of(lockResource));
        }
        for (ResourceStatus status : statuses) {
            log.debug("Resource {}: healthy={}, metrics={}", status.name(), status.healthy(), status.metrics());
        }
        return statuses;
    }

    private void writeRunMetadata(SqliteStore store, Duration window, boolean successfulSync) {
        try {
            if (window != null) {
                store.putMetadata(SqliteStore.META_HOURS_LOOKBACK, Long.toString(window.toHours()));
            }
            if (successfulSync) {
                store.putMetadata(SqliteStore.META_LAST_SUCCESSFUL_SYNC, clock.instant().toString());
            }
        } catch (SQLException e) {
            log.warn("Failed to write run metadata to {}: {}", store.path(), e.getMessage());
        }
    }
}
