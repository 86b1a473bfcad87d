package org.elogsync.pipeline.services;

import org.elogsync.config.SyncSettings;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Parameters of one {@link SyncService#sync(SyncRequest)} call.
 *
 * @param window        Lookback window, or {@code null} to derive it (see {@link SyncService})
 * @param exclude       Shell-style exclude patterns
 * @param parallelism   Concurrent fetches
 * @param batchSize     Experiments per transaction
 * @param queueCapacity Results buffered between fetchers and writer
 * @param incremental   Seed the new store from an existing one
 * @param baseStore     Store to seed from in incremental mode, or {@code null} for the latest store
 * @param targetStore   Store to write in place, or {@code null} for a new timestamped store
 * @param outputDir     Directory for stores, lock and ledger
 */
public record SyncRequest(
    Duration window,
    List<String> exclude,
    int parallelism,
    int batchSize,
    int queueCapacity,
    boolean incremental,
    Path baseStore,
    Path targetStore,
    Path outputDir
) {

    public SyncRequest {
        exclude = exclude == null ? List.of() : List.copyOf(exclude);
        Objects.requireNonNull(outputDir, "outputDir must not be null");
        if (parallelism < 1 || batchSize < 1 || queueCapacity < 1) {
            throw new IllegalArgumentException("parallelism, batch size and queue capacity must be at least 1");
        }
        if (baseStore != null && !incremental) {
            throw new IllegalArgumentException("a base store requires incremental mode");
        }
        if (baseStore != null && targetStore != null) {
            throw new IllegalArgumentException("a base store cannot be combined with a target store");
        }
        if (window != null && window.isNegative()) {
            throw new IllegalArgumentException("window must not be negative");
        }
    }

    /**
     * @return A builder pre-filled from the configured defaults
     */
    public static Builder builder(SyncSettings settings) {
        return new Builder(settings);
    }

    public static final class Builder {
        private Duration window;
        private List<String> exclude;
        private int parallelism;
        private int batchSize;
        private int queueCapacity;
        private boolean incremental;
        private Path baseStore;
        private Path targetStore;
        private Path outputDir;

        private Builder(SyncSettings settings) {
            this.exclude = settings.exclude();
            this.parallelism = settings.parallelism();
            this.batchSize = settings.batchSize();
            this.queueCapacity = settings.queueCapacity();
            this.outputDir = settings.databaseDir();
        }

        public Builder window(Duration window) {
            this.window = window;
            return this;
        }

        public Builder exclude(List<String> exclude) {
            this.exclude = exclude;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder queueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
            return this;
        }

        public Builder incremental(boolean incremental) {
            this.incremental = incremental;
            return this;
        }

        /**
         * Seeds the run from {@code baseStore} instead of the latest store. Implies incremental mode.
         */
        public Builder baseStore(Path baseStore) {
            this.baseStore = baseStore;
            if (baseStore != null) {
                this.incremental = true;
            }
            return this;
        }

        public Builder targetStore(Path targetStore) {
            this.targetStore = targetStore;
            return this;
        }

        public Builder outputDir(Path outputDir) {
            this.outputDir = outputDir;
            return this;
        }

        public SyncRequest build() {
            return new SyncRequest(window, exclude, parallelism, batchSize, queueCapacity,
                incremental, baseStore, targetStore, outputDir);
        }
    }
}
