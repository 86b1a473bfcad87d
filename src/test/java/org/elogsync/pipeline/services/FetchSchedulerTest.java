package org.elogsync.pipeline.services;

import org.elogsync.pipeline.api.contracts.ChangeSet;
import org.elogsync.pipeline.api.contracts.ErrorKind;
import org.elogsync.pipeline.api.contracts.FetchResult;
import org.elogsync.pipeline.resources.queues.BoundedResultQueue;
import org.elogsync.pipeline.resources.retry.RetryPolicy;
import org.elogsync.pipeline.testsupport.ScriptedRemoteSource;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

@Tag("integration")
class FetchSchedulerTest {

    private final ScriptedRemoteSource source = new ScriptedRemoteSource();

    private FetchScheduler scheduler(int parallelism, int queueCapacity) {
        return new FetchScheduler(new EntityFetcher(source, RetryPolicy.immediate(3)), parallelism, queueCapacity);
    }

    private static ChangeSet ids(int count) {
        return ChangeSet.of(IntStream.range(0, count).mapToObj(i -> "exp" + i).toList());
    }

    private static List<FetchResult> drain(BoundedResultQueue<FetchResult> results) throws InterruptedException {
        List<FetchResult> all = new ArrayList<>();
        Optional<FetchResult> next;
        while ((next = results.take()).isPresent()) {
            all.add(next.get());
        }
        return all;
    }

    @Test
    void everyIdentifierYieldsExactlyOneResult() throws Exception {
        ChangeSet changeSet = ids(25);
        FetchScheduler scheduler = scheduler(4, 5);

        List<FetchResult> results = drain(scheduler.start(changeSet));

        assertThat(results).extracting(FetchResult::identifier)
            .containsExactlyInAnyOrderElementsOf(changeSet.identifiers());
        assertThat(results).allMatch(r -> r instanceof FetchResult.Success);
        assertThat(scheduler.awaitTermination(Duration.ofSeconds(5))).isTrue();
        assertThat(scheduler.getState()).isEqualTo(FetchScheduler.State.COMPLETED);
    }

    @Test
    void concurrentFetchesNeverExceedParallelism() throws Exception {
        source.fetchDelay(Duration.ofMillis(20));
        FetchScheduler scheduler = scheduler(3, 50);

        List<FetchResult> results = drain(scheduler.start(ids(20)));

        assertThat(results).hasSize(20);
        assertThat(source.maxConcurrentFetches()).isLessThanOrEqualTo(3);
        assertThat(scheduler.getMaxInFlight()).isBetween(1, 3);
    }

    @Test
    void workersBlockWhileTheQueueIsFull() throws Exception {
        FetchScheduler scheduler = scheduler(2, 2);

        BoundedResultQueue<FetchResult> results = scheduler.start(ids(10));
        await().atMost(Duration.ofSeconds(5)).until(() -> results.size() == 2);
        Thread.sleep(100);

        // two results queued plus at most one blocked result per worker
        assertThat(source.totalFetches()).isLessThanOrEqualTo(4);
        assertThat(drain(results)).hasSize(10);
    }

    @Test
    void emptyChangeSetCompletesImmediately() throws Exception {
        FetchScheduler scheduler = scheduler(4, 4);

        assertThat(drain(scheduler.start(ChangeSet.empty()))).isEmpty();
        assertThat(source.totalFetches()).isZero();
    }

    @Test
    void cancelDeliversUndispatchedIdentifiersAsCancelled() throws Exception {
        CountDownLatch gate = source.gateFetches();
        FetchScheduler scheduler = scheduler(1, 10);

        BoundedResultQueue<FetchResult> results = scheduler.start(ids(5));
        await().atMost(Duration.ofSeconds(5)).until(() -> source.totalFetches() == 1);
        scheduler.cancel();
        gate.countDown();

        List<FetchResult> all = drain(results);

        assertThat(all).hasSize(5);
        assertThat(all.get(0)).isInstanceOf(FetchResult.Success.class);
        assertThat(all.subList(1, 5)).allSatisfy(r -> {
            assertThat(r).isInstanceOf(FetchResult.Failure.class);
            assertThat(((FetchResult.Failure) r).kind()).isEqualTo(ErrorKind.CANCELLED);
            assertThat(((FetchResult.Failure) r).attempts()).isZero();
        });
        assertThat(source.totalFetches()).isEqualTo(1);
        assertThat(scheduler.isCancelled()).isTrue();
    }

    @Test
    void schedulerCannotBeStartedTwice() throws Exception {
        FetchScheduler scheduler = scheduler(1, 1);
        drain(scheduler.start(ids(1)));

        assertThatThrownBy(() -> scheduler.start(ids(1))).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void invalidSizesAreRejected() {
        EntityFetcher fetcher = new EntityFetcher(source, RetryPolicy.immediate(1));

        assertThatThrownBy(() -> new FetchScheduler(fetcher, 0, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FetchScheduler(fetcher, 1, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
