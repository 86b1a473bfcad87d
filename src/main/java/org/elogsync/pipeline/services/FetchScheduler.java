package org.elogsync.pipeline.services;

import org.elogsync.pipeline.api.contracts.ChangeSet;
import org.elogsync.pipeline.api.contracts.ErrorKind;
import org.elogsync.pipeline.api.contracts.FetchResult;
import org.elogsync.pipeline.resources.queues.BoundedResultQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs fetches for a change set on a fixed number of worker threads and streams every outcome
 * into a {@link BoundedResultQueue}.
 * <p>
 * Each identifier yields exactly one result. Once every worker has finished, the queue is
 * completed so the consumer sees the end of the stream. Producers block while the queue is
 * full, so the number of fetched but unwritten bundles never exceeds its capacity.
 * <p>
 * {@link #cancel()} stops dispatching: in-flight fetches finish and are delivered, and every
 * identifier not yet dispatched is delivered as a {@link ErrorKind#CANCELLED} failure.
 */
public class FetchScheduler {

    private static final Logger log = LoggerFactory.getLogger(FetchScheduler.class);

    public enum State { IDLE, RUNNING, COMPLETED }

    private final EntityFetcher fetcher;
    private final int parallelism;
    private final int queueCapacity;

    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicInteger inFlight = new AtomicInteger(0);
    private final AtomicInteger maxInFlight = new AtomicInteger(0);
    private final CountDownLatch finished = new CountDownLatch(1);

    /**
     * @param fetcher       Fetcher shared by all workers
     * @param parallelism   Maximum number of concurrent fetches (at least 1)
     * @param queueCapacity Capacity of the result queue (at least 1)
     */
    public FetchScheduler(EntityFetcher fetcher, int parallelism, int queueCapacity) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher must not be null");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, got " + parallelism);
        }
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queue capacity must be at least 1, got " + queueCapacity);
        }
        this.parallelism = parallelism;
        this.queueCapacity = queueCapacity;
    }

    /**
     * Starts fetching the given change set in the background.
     *
     * @return The queue the results are streamed into
     * @throws IllegalStateException if this scheduler was already started
     */
    public BoundedResultQueue<FetchResult> start(ChangeSet changeSet) {
        if (!state.compareAndSet(State.IDLE, State.RUNNING)) {
            throw new IllegalStateException("Scheduler already started (state: " + state.get() + ")");
        }
        BoundedResultQueue<FetchResult> results = new BoundedResultQueue<>("fetch-results", queueCapacity);
        ConcurrentLinkedQueue<String> pending = new ConcurrentLinkedQueue<>(changeSet.identifiers());

        int workerCount = Math.max(1, Math.min(parallelism, changeSet.size()));
        CountDownLatch workersDone = new CountDownLatch(workerCount);
        for (int i = 0; i < workerCount; i++) {
            Thread worker = new Thread(() -> {
                try {
                    runWorker(pending, results);
                } finally {
                    workersDone.countDown();
                }
            }, "fetch-worker-" + i);
            worker.start();
        }

        Thread coordinator = new Thread(() -> finish(pending, results, workersDone), "fetch-coordinator");
        coordinator.start();
        log.debug("Fetching {} experiments with {} workers (queue capacity {})",
            changeSet.size(), workerCount, queueCapacity);
        return results;
    }

    private void runWorker(ConcurrentLinkedQueue<String> pending, BoundedResultQueue<FetchResult> results) {
        String id;
        while (!cancelled.get() && (id = pending.poll()) != null) {
            int current = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(current, Math::max);
            FetchResult result;
            try {
                result = fetcher.fetch(id);
            } finally {
                inFlight.decrementAndGet();
            }
            deliver(results, result);
        }
    }

    private void finish(ConcurrentLinkedQueue<String> pending, BoundedResultQueue<FetchResult> results,
                        CountDownLatch workersDone) {
        awaitUninterruptibly(workersDone);
        int skipped = 0;
        String id;
        while ((id = pending.poll()) != null) {
            deliver(results, new FetchResult.Failure(id, ErrorKind.CANCELLED, "Cancelled before fetch", 0));
            skipped++;
        }
        if (skipped > 0) {
            log.info("Cancelled {} experiments that were not yet fetched", skipped);
        }
        boolean interrupted = false;
        while (true) {
            try {
                results.complete();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        state.set(State.COMPLETED);
        finished.countDown();
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Puts a result even if the calling thread is interrupted; a result is never dropped.
     */
    private static void deliver(BoundedResultQueue<FetchResult> results, FetchResult result) {
        boolean interrupted = false;
        while (true) {
            try {
                results.put(result);
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private static void awaitUninterruptibly(CountDownLatch latch) {
        boolean interrupted = false;
        while (true) {
            try {
                latch.await();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Stops dispatching new fetches. In-flight fetches complete normally. Idempotent.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.info("Cancellation requested, finishing in-flight fetches");
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Waits until all workers have finished and the result stream is completed.
     *
     * @return true if the scheduler finished within the timeout
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public State getState() {
        return state.get();
    }

    /**
     * @return The highest number of concurrently running fetches observed so far
     */
    public int getMaxInFlight() {
        return maxInFlight.get();
    }
}
