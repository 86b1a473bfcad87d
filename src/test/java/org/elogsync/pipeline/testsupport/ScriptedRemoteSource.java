package org.elogsync.pipeline.testsupport;

import org.elogsync.pipeline.api.contracts.RecordBundle;
import org.elogsync.pipeline.api.source.IRemoteSource;
import org.elogsync.pipeline.api.source.PermanentSourceException;
import org.elogsync.pipeline.api.source.SourceUnavailableException;
import org.elogsync.pipeline.api.source.TransientSourceException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory remote source whose listing and per-experiment behaviour are scripted by the test.
 * Unscripted experiments succeed with {@link Bundles#sample(String)}.
 */
public class ScriptedRemoteSource implements IRemoteSource {

    private final List<String> listing = new ArrayList<>();
    private final Map<String, Behaviour> behaviours = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> fetchCounts = new ConcurrentHashMap<>();
    private final AtomicInteger concurrentFetches = new AtomicInteger();
    private final AtomicInteger maxConcurrentFetches = new AtomicInteger();
    private volatile boolean listingUnavailable;
    private volatile Duration lastListWindow;
    private volatile Duration fetchDelay = Duration.ZERO;
    private volatile CountDownLatch fetchGate;

    private sealed interface Behaviour permits Succeed, FailPermanently, FailTransiently {
    }

    private record Succeed(RecordBundle bundle) implements Behaviour {
    }

    private record FailPermanently(String message) implements Behaviour {
    }

    private record FailTransiently(int times) implements Behaviour {
    }

    public ScriptedRemoteSource listing(String... ids) {
        listing.clear();
        listing.addAll(List.of(ids));
        return this;
    }

    public ScriptedRemoteSource succeed(String id, RecordBundle bundle) {
        behaviours.put(id, new Succeed(bundle));
        return this;
    }

    public ScriptedRemoteSource failPermanently(String id) {
        behaviours.put(id, new FailPermanently("HTTP 403 for " + id));
        return this;
    }

    /**
     * Fails the first {@code times} fetches of {@code id} transiently, then succeeds.
     * {@link Integer#MAX_VALUE} fails forever.
     */
    public ScriptedRemoteSource failTransiently(String id, int times) {
        behaviours.put(id, new FailTransiently(times));
        return this;
    }

    public ScriptedRemoteSource reset(String id) {
        behaviours.remove(id);
        return this;
    }

    public ScriptedRemoteSource listingUnavailable(boolean unavailable) {
        this.listingUnavailable = unavailable;
        return this;
    }

    public ScriptedRemoteSource fetchDelay(Duration delay) {
        this.fetchDelay = delay;
        return this;
    }

    /**
     * Blocks every fetch until the returned latch is counted down.
     */
    public CountDownLatch gateFetches() {
        CountDownLatch gate = new CountDownLatch(1);
        this.fetchGate = gate;
        return gate;
    }

    @Override
    public List<String> listChanged(Duration window) throws SourceUnavailableException {
        lastListWindow = window;
        if (listingUnavailable) {
            throw new SourceUnavailableException("listing failed: HTTP 503", null);
        }
        return List.copyOf(listing);
    }

    @Override
    public RecordBundle fetchRecord(String experimentId)
            throws TransientSourceException, PermanentSourceException, InterruptedException {
        int attempt = fetchCounts.computeIfAbsent(experimentId, k -> new AtomicInteger()).incrementAndGet();
        int current = concurrentFetches.incrementAndGet();
        maxConcurrentFetches.accumulateAndGet(current, Math::max);
        try {
            CountDownLatch gate = fetchGate;
            if (gate != null && !gate.await(10, TimeUnit.SECONDS)) {
                throw new TransientSourceException("gate timed out");
            }
            if (!fetchDelay.isZero()) {
                Thread.sleep(fetchDelay.toMillis());
            }
            Behaviour behaviour = behaviours.get(experimentId);
            if (behaviour instanceof FailPermanently failure) {
                throw new PermanentSourceException(failure.message(), 403);
            }
            if (behaviour instanceof FailTransiently failure && attempt <= failure.times()) {
                throw new TransientSourceException("HTTP 503 for " + experimentId, 503);
            }
            if (behaviour instanceof Succeed success) {
                return success.bundle();
            }
            return Bundles.sample(experimentId);
        } finally {
            concurrentFetches.decrementAndGet();
        }
    }

    @Override
    public String getResourceName() {
        return "scripted-source";
    }

    public int fetchCount(String id) {
        AtomicInteger count = fetchCounts.get(id);
        return count != null ? count.get() : 0;
    }

    public int totalFetches() {
        return fetchCounts.values().stream().mapToInt(AtomicInteger::get).sum();
    }

    public int maxConcurrentFetches() {
        return maxConcurrentFetches.get();
    }

    public Duration lastListWindow() {
        return lastListWindow;
    }
}
