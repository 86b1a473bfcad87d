package org.elogsync.pipeline.services;

import org.elogsync.pipeline.api.contracts.ErrorKind;
import org.elogsync.pipeline.api.contracts.FetchResult;
import org.elogsync.pipeline.api.contracts.RecordBundle;
import org.elogsync.pipeline.api.source.IRemoteSource;
import org.elogsync.pipeline.api.source.PermanentSourceException;
import org.elogsync.pipeline.api.source.TransientSourceException;
import org.elogsync.pipeline.resources.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fetches the complete bundle of one experiment, retrying transient errors with backoff.
 * <p>
 * {@link #fetch(String)} never throws: every outcome is returned as a {@link FetchResult}, so
 * worker threads hand values to the writer instead of exceptions. Permanent errors fail without
 * retry. Thread-safe.
 */
public class EntityFetcher {

    private static final Logger log = LoggerFactory.getLogger(EntityFetcher.class);

    private final IRemoteSource source;
    private final RetryPolicy retryPolicy;

    private final AtomicLong retries = new AtomicLong(0);
    private final AtomicLong successes = new AtomicLong(0);
    private final AtomicLong failures = new AtomicLong(0);

    public EntityFetcher(IRemoteSource source, RetryPolicy retryPolicy) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
    }

    public FetchResult fetch(String experimentId) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                RecordBundle bundle = source.fetchRecord(experimentId);
                if (bundle == null || !experimentId.equals(bundle.experimentId())) {
                    return fail(new FetchResult.Failure(experimentId, ErrorKind.FETCH_PERMANENT,
                        "Remote source returned no bundle for " + experimentId, attempt));
                }
                successes.incrementAndGet();
                if (attempt > 1) {
                    log.debug("Fetched {} on attempt {}", experimentId, attempt);
                }
                return new FetchResult.Success(experimentId, bundle, attempt);
            } catch (TransientSourceException e) {
                if (!retryPolicy.canRetry(attempt)) {
                    return fail(new FetchResult.Failure(experimentId, ErrorKind.FETCH_TRANSIENT,
                        e.getMessage(), attempt));
                }
                long delay = retryPolicy.delayMs(attempt - 1);
                retries.incrementAndGet();
                log.debug("Fetch of {} failed (attempt {}/{}): {}, retrying in {} ms",
                    experimentId, attempt, retryPolicy.getMaxAttempts(), e.getMessage(), delay);
                try {
                    TimeUnit.MILLISECONDS.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return interrupted(experimentId, attempt);
                }
            } catch (PermanentSourceException e) {
                return fail(new FetchResult.Failure(experimentId, ErrorKind.FETCH_PERMANENT, e.getMessage(), attempt));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return interrupted(experimentId, attempt);
            } catch (RuntimeException e) {
                log.debug("Unexpected error fetching {}:", experimentId, e);
                return fail(new FetchResult.Failure(experimentId, ErrorKind.FETCH_PERMANENT,
                    e.getClass().getSimpleName() + ": " + e.getMessage(), attempt));
            }
        }
    }

    private FetchResult.Failure fail(FetchResult.Failure failure) {
        failures.incrementAndGet();
        log.warn("Failed to fetch {} after {} attempt(s) [{}]: {}",
            failure.identifier(), failure.attempts(), failure.kind(), failure.error());
        return failure;
    }

    private FetchResult.Failure interrupted(String experimentId, int attempt) {
        failures.incrementAndGet();
        log.debug("Fetch of {} interrupted on attempt {}", experimentId, attempt);
        return new FetchResult.Failure(experimentId, ErrorKind.CANCELLED, "Interrupted while fetching", attempt);
    }

    public long getRetryCount() {
        return retries.get();
    }

    public long getSuccessCount() {
        return successes.get();
    }

    public long getFailureCount() {
        return failures.get();
    }
}
