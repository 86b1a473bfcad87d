package org.elogsync.pipeline.services;

import org.elogsync.junit.extensions.logging.ExpectLog;
import org.elogsync.junit.extensions.logging.LogLevel;
import org.elogsync.junit.extensions.logging.LogWatchExtension;
import org.elogsync.pipeline.api.contracts.ErrorKind;
import org.elogsync.pipeline.api.contracts.FetchResult;
import org.elogsync.pipeline.api.contracts.LedgerEntry;
import org.elogsync.pipeline.api.contracts.RecordBundle;
import org.elogsync.pipeline.api.resources.IBundleWriter;
import org.elogsync.pipeline.resources.ledger.FailureLedger;
import org.elogsync.pipeline.resources.queues.BoundedResultQueue;
import org.elogsync.pipeline.testsupport.Bundles;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@Tag("unit")
@ExtendWith({MockitoExtension.class, LogWatchExtension.class})
class BatchWriterTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

    @Mock
    private IBundleWriter bundleWriter;

    private FailureLedger ledger;
    private final AtomicInteger fatalCalls = new AtomicInteger();

    @BeforeEach
    void setUp() {
        ledger = new FailureLedger(CLOCK);
    }

    private BatchWriter writer(int batchSize) {
        return new BatchWriter(bundleWriter, batchSize, ledger, CLOCK, fatalCalls::incrementAndGet);
    }

    private static BoundedResultQueue<FetchResult> stream(FetchResult... results) throws InterruptedException {
        BoundedResultQueue<FetchResult> queue = new BoundedResultQueue<>("test-results", results.length + 1);
        for (FetchResult r : results) {
            queue.put(r);
        }
        queue.complete();
        return queue;
    }

    private static FetchResult success(String id) {
        return new FetchResult.Success(id, Bundles.sample(id, 1), 1);
    }

    @Test
    @SuppressWarnings("unchecked")
    void fullBatchesAndRemainderAreCommitted() throws Exception {
        BatchWriter.Outcome outcome = writer(2).consume(stream(
            success("a"), success("b"), success("c"), success("d"), success("e")));

        ArgumentCaptor<List<RecordBundle>> batches = ArgumentCaptor.forClass(List.class);
        verify(bundleWriter, times(3)).writeBatch(batches.capture(), any(Instant.class));
        assertThat(batches.getAllValues()).extracting(List::size).containsExactly(2, 2, 1);
        assertThat(outcome.committed()).containsExactly("a", "b", "c", "d", "e");
        assertThat(outcome.batchesCommitted()).isEqualTo(3);
        assertThat(ledger.isEmpty()).isTrue();
    }

    @Test
    void failuresGoToTheLedgerAndEmptyRemainderIsNotCommitted() throws Exception {
        BatchWriter.Outcome outcome = writer(1).consume(stream(
            success("a"),
            new FetchResult.Failure("b", ErrorKind.FETCH_PERMANENT, "HTTP 403", 1)));

        verify(bundleWriter, times(1)).writeBatch(anyList(), any(Instant.class));
        assertThat(outcome.committed()).containsExactly("a");
        assertThat(ledger.entries()).extracting(LedgerEntry::experimentId).containsExactly("b");
    }

    @Test
    void streamWithOnlyFailuresWritesNothing() throws Exception {
        writer(3).consume(stream(new FetchResult.Failure("a", ErrorKind.FETCH_TRANSIENT, "HTTP 503", 3)));

        verify(bundleWriter, never()).writeBatch(anyList(), any(Instant.class));
        assertThat(ledger.size()).isEqualTo(1);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Rolled back batch of 2 experiments: SQLException: disk I/O error")
    void rolledBackBatchRecordsEveryMemberAsPersistenceFailure() throws Exception {
        doThrow(new SQLException("disk I/O error"))
            .doNothing()
            .when(bundleWriter).writeBatch(anyList(), any(Instant.class));

        BatchWriter.Outcome outcome = writer(2).consume(stream(
            success("a"), success("b"), success("c"), success("d")));

        assertThat(outcome.committed()).containsExactly("c", "d");
        assertThat(outcome.batchesRolledBack()).isEqualTo(1);
        assertThat(outcome.fatal()).isFalse();
        assertThat(ledger.entries()).allSatisfy(e -> {
            assertThat(e.errorKind()).isEqualTo(ErrorKind.PERSISTENCE);
            assertThat(e.error()).isEqualTo("SQLException: disk I/O error");
        });
        assertThat(ledger.entries()).extracting(LedgerEntry::experimentId).containsExactlyInAnyOrder("a", "b");
        assertThat(fatalCalls.get()).isZero();
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Rolled back batch.*", occurrences = 3)
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Store failed 3 consecutive commits, stopping writes")
    void repeatedCommitFailuresStopWriting() throws Exception {
        doThrow(new SQLException("database is locked")).when(bundleWriter).writeBatch(anyList(), any(Instant.class));

        BatchWriter.Outcome outcome = writer(1).consume(stream(
            success("a"), success("b"), success("c"), success("d"), success("e")));

        verify(bundleWriter, times(3)).writeBatch(anyList(), any(Instant.class));
        assertThat(outcome.fatal()).isTrue();
        assertThat(outcome.committed()).isEmpty();
        assertThat(ledger.size()).isEqualTo(5);
        assertThat(ledger.entries()).allMatch(e -> e.errorKind() == ErrorKind.PERSISTENCE);
        assertThat(fatalCalls.get()).isEqualTo(1);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Rolled back batch.*", occurrences = 2)
    void successfulCommitResetsTheFailureStreak() throws Exception {
        doThrow(new SQLException("busy"))
            .doThrow(new SQLException("busy"))
            .doNothing()
            .doThrow(new SQLException("busy"))
            .doNothing()
            .when(bundleWriter).writeBatch(anyList(), any(Instant.class));

        BatchWriter.Outcome outcome = writer(1).consume(stream(
            success("a"), success("b"), success("c"), success("d"), success("e")));

        assertThat(outcome.fatal()).isFalse();
        assertThat(outcome.committed()).containsExactly("c", "e");
    }
}
