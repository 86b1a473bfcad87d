package org.elogsync.pipeline.resources.queues;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

@Tag("unit")
class BoundedResultQueueTest {

    @Test
    void deliversElementsThenEndOfStream() throws InterruptedException {
        BoundedResultQueue<String> queue = new BoundedResultQueue<>("results", 4);
        queue.put("a");
        queue.put("b");
        queue.complete();

        assertThat(queue.take()).contains("a");
        assertThat(queue.take()).contains("b");
        assertThat(queue.take()).isEmpty();
        assertThat(queue.take()).isEmpty();
    }

    @Test
    @Timeout(5)
    void producerBlocksWhileQueueIsFull() throws InterruptedException {
        BoundedResultQueue<String> queue = new BoundedResultQueue<>("results", 2);
        queue.put("a");
        queue.put("b");

        AtomicBoolean thirdPut = new AtomicBoolean(false);
        CountDownLatch started = new CountDownLatch(1);
        Thread producer = new Thread(() -> {
            started.countDown();
            try {
                queue.put("c");
                thirdPut.set(true);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        producer.start();
        started.await();

        await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(1)).untilFalse(thirdPut);
        assertThat(queue.size()).isEqualTo(2);

        assertThat(queue.take()).contains("a");
        await().atMost(Duration.ofSeconds(2)).untilTrue(thirdPut);
        producer.join();
        assertThat(queue.getMetrics().get("high_water_mark").intValue()).isEqualTo(2);
    }

    @Test
    void completeDoesNotNeedAFreeSlot() throws InterruptedException {
        BoundedResultQueue<String> queue = new BoundedResultQueue<>("results", 1);
        queue.put("a");
        queue.complete();
        queue.complete();

        assertThat(queue.isCompleted()).isTrue();
        assertThat(queue.size()).isEqualTo(1);
        assertThat(queue.take()).isEqualTo(Optional.of("a"));
        assertThat(queue.take()).isEmpty();
    }

    @Test
    void putAfterCompleteFails() throws InterruptedException {
        BoundedResultQueue<String> queue = new BoundedResultQueue<>("results", 1);
        queue.complete();

        assertThatThrownBy(() -> queue.put("late")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void capacityComesFromOptions() {
        BoundedResultQueue<String> queue = new BoundedResultQueue<>("results", ConfigFactory.parseMap(Map.of("capacity", 7)));

        assertThat(queue.getCapacity()).isEqualTo(7);
        assertThat(queue.getMetrics()).containsEntry("capacity", 7);
        assertThatThrownBy(() -> new BoundedResultQueue<String>("bad", 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
