package org.elogsync.pipeline.resources.queues;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.elogsync.pipeline.resources.AbstractResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded single-consumer channel between the fetch workers and the batch writer.
 * <p>
 * Producers block in {@link #put(Object)} while the queue is full, which bounds memory when the
 * writer is slower than the fetchers. {@link #complete()} appends an end-of-stream marker after
 * the last element; once the consumer has seen it, {@link #take()} returns empty.
 *
 * @param <T> The element type.
 */
public class BoundedResultQueue<T> extends AbstractResource {

    private static final Logger log = LoggerFactory.getLogger(BoundedResultQueue.class);
    private static final Object END_OF_STREAM = new Object();

    private final ArrayBlockingQueue<Object> queue;
    private final Semaphore slots;
    private final int capacity;
    private final AtomicBoolean completed = new AtomicBoolean(false);
    private volatile boolean endSeen = false;

    private final AtomicLong totalPut = new AtomicLong(0);
    private final AtomicLong totalTaken = new AtomicLong(0);
    private final AtomicInteger highWaterMark = new AtomicInteger(0);

    /**
     * @param name    The resource name.
     * @param options Config with optional {@code capacity} (default 100).
     * @throws IllegalArgumentException if the capacity is not positive.
     */
    public BoundedResultQueue(String name, Config options) {
        super(name, options);
        Config defaults = ConfigFactory.parseMap(Map.of("capacity", 100));
        Config finalConfig = options.withFallback(defaults);
        this.capacity = finalConfig.getInt("capacity");
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive for resource '" + name + "'.");
        }
        // results are bounded by the semaphore; the extra slot is reserved for the end marker
        this.slots = new Semaphore(capacity);
        this.queue = new ArrayBlockingQueue<>(capacity + 1);
    }

    public BoundedResultQueue(String name, int capacity) {
        this(name, ConfigFactory.parseMap(Map.of("capacity", capacity)));
    }

    /**
     * Appends an element, blocking while the queue holds {@code capacity} elements.
     *
     * @throws IllegalStateException if {@link #complete()} was already called
     * @throws InterruptedException  if interrupted while waiting for space
     */
    public void put(T element) throws InterruptedException {
        if (element == null) {
            throw new IllegalArgumentException("element must not be null");
        }
        if (completed.get()) {
            throw new IllegalStateException("Queue '" + resourceName + "' is already completed");
        }
        slots.acquire();
        queue.put(element);
        totalPut.incrementAndGet();
        highWaterMark.accumulateAndGet(queue.size(), Math::max);
    }

    /**
     * Marks the end of the stream. Idempotent.
     *
     * @throws InterruptedException if interrupted while waiting for space
     */
    public void complete() throws InterruptedException {
        if (completed.compareAndSet(false, true)) {
            queue.put(END_OF_STREAM);
            log.debug("Queue '{}' completed after {} elements", resourceName, totalPut.get());
        }
    }

    /**
     * Takes the next element, blocking until one is available.
     *
     * @return The next element, or empty once the end of the stream was reached
     * @throws InterruptedException if interrupted while waiting
     */
    @SuppressWarnings("unchecked")
    public Optional<T> take() throws InterruptedException {
        if (endSeen) {
            return Optional.empty();
        }
        Object next = queue.take();
        if (next == END_OF_STREAM) {
            endSeen = true;
            return Optional.empty();
        }
        slots.release();
        totalTaken.incrementAndGet();
        return Optional.of((T) next);
    }

    public int size() {
        int size = queue.size();
        return completed.get() && !endSeen ? Math.max(0, size - 1) : size;
    }

    public int getCapacity() {
        return capacity;
    }

    public boolean isCompleted() {
        return completed.get();
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("capacity", capacity);
        metrics.put("current_size", size());
        metrics.put("high_water_mark", highWaterMark.get());
        metrics.put("total_put", totalPut.get());
        metrics.put("total_taken", totalTaken.get());
    }
}
