package org.elogsync.pipeline.resources.ledger;

import org.elogsync.pipeline.api.contracts.ChangeSet;
import org.elogsync.pipeline.api.contracts.ErrorKind;
import org.elogsync.pipeline.api.contracts.FetchResult;
import org.elogsync.pipeline.api.contracts.LedgerEntry;
import org.elogsync.pipeline.api.resources.CorruptLedgerException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class FailureLedgerTest {

    @TempDir
    Path tempDir;

    private Path ledgerFile;
    private FailureLedger ledger;

    @BeforeEach
    void setUp() {
        ledgerFile = tempDir.resolve("failed_experiments.json");
        ledger = new FailureLedger(Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void flushesAndLoadsEntries() throws Exception {
        ledger.record(new FetchResult.Failure("cxi0001", ErrorKind.FETCH_PERMANENT, "HTTP 403", 1));
        ledger.record(new FetchResult.Failure("txi9999", ErrorKind.FETCH_TRANSIENT, "HTTP 503", 3));

        assertThat(ledger.flush(ledgerFile)).isTrue();

        List<LedgerEntry> loaded = FailureLedger.load(ledgerFile);
        assertThat(loaded).extracting(LedgerEntry::experimentId).containsExactly("cxi0001", "txi9999");
        assertThat(loaded.get(1).errorKind()).isEqualTo(ErrorKind.FETCH_TRANSIENT);
        assertThat(loaded.get(1).attempts()).isEqualTo(3);
        assertThat(loaded.get(0).timestamp()).isEqualTo("2024-05-01T10:00:00Z");
        assertThat(FailureLedger.loadChangeSet(ledgerFile)).isEqualTo(ChangeSet.of("cxi0001", "txi9999"));
        assertThat(Files.list(tempDir)).containsExactly(ledgerFile);
    }

    @Test
    void laterFailureOfSameExperimentReplacesEarlierOne() {
        ledger.record(new FetchResult.Failure("cxi0001", ErrorKind.FETCH_TRANSIENT, "first", 3));
        ledger.record(new FetchResult.Failure("cxi0001", ErrorKind.PERSISTENCE, "second", 1));

        assertThat(ledger.size()).isEqualTo(1);
        assertThat(ledger.entries().get(0).errorKind()).isEqualTo(ErrorKind.PERSISTENCE);
    }

    @Test
    void emptyLedgerDeletesExistingFile() throws Exception {
        Files.writeString(ledgerFile, "[]");

        assertThat(ledger.flush(ledgerFile)).isFalse();
        assertThat(ledgerFile).doesNotExist();
    }

    @Test
    void loadsLegacyEntriesWithoutKind() throws Exception {
        Files.writeString(ledgerFile,
            "[{\"experiment_id\": \"cxi0001\", \"error\": \"timeout\", \"timestamp\": \"2024-01-01T00:00:00\"}]");

        List<LedgerEntry> loaded = FailureLedger.load(ledgerFile);

        assertThat(loaded).hasSize(1);
        assertThat(loaded.get(0).errorKind()).isNull();
    }

    @Test
    void missingFileIsCorrupt() {
        assertThatThrownBy(() -> FailureLedger.load(tempDir.resolve("absent.json")))
            .isInstanceOf(CorruptLedgerException.class)
            .hasMessageContaining("file not found");
    }

    @Test
    void malformedJsonIsCorrupt() throws IOException {
        Files.writeString(ledgerFile, "[{\"experiment_id\": ");

        assertThatThrownBy(() -> FailureLedger.loadChangeSet(ledgerFile))
            .isInstanceOf(CorruptLedgerException.class);
    }

    @Test
    void wrongShapeIsCorrupt() throws IOException {
        Files.writeString(ledgerFile, "{\"experiment_id\": \"cxi0001\"}");

        assertThatThrownBy(() -> FailureLedger.load(ledgerFile))
            .isInstanceOf(CorruptLedgerException.class);
    }

    @Test
    void entryWithoutIdentifierIsCorrupt() throws IOException {
        Files.writeString(ledgerFile, "[{\"error\": \"timeout\"}]");

        assertThatThrownBy(() -> FailureLedger.loadChangeSet(ledgerFile))
            .isInstanceOf(CorruptLedgerException.class);
    }

    @Test
    void carriedEntriesAreFlushedButNotReportedAsThisRun() throws Exception {
        List<LedgerEntry> previous = List.of(
            new LedgerEntry("cxi0001", "HTTP 403", ErrorKind.FETCH_PERMANENT, 1, "2024-04-30T10:00:00Z"),
            new LedgerEntry("mfxl1033223", "HTTP 503", ErrorKind.FETCH_TRANSIENT, 3, "2024-04-30T10:00:00Z"));

        int carried = ledger.carryOver(previous, ChangeSet.of("mfxl1033223", "xpp0001"));
        ledger.record(new FetchResult.Failure("xpp0001", ErrorKind.FETCH_PERMANENT, "HTTP 404", 1));

        assertThat(carried).isEqualTo(1);
        assertThat(ledger.entries()).extracting(LedgerEntry::experimentId).containsExactly("xpp0001");
        assertThat(ledger.flush(ledgerFile)).isTrue();
        assertThat(FailureLedger.load(ledgerFile)).extracting(LedgerEntry::experimentId)
            .containsExactly("cxi0001", "xpp0001");
    }

    @Test
    void carriedEntriesAloneKeepTheFile() throws Exception {
        ledger.carryOver(List.of(new LedgerEntry("cxi0001", "HTTP 403", ErrorKind.FETCH_PERMANENT, 1,
            "2024-04-30T10:00:00Z")), ChangeSet.of("mfxl1033223"));

        assertThat(ledger.isEmpty()).isTrue();
        assertThat(ledger.flush(ledgerFile)).isTrue();
        assertThat(FailureLedger.load(ledgerFile)).singleElement()
            .satisfies(e -> assertThat(e.timestamp()).isEqualTo("2024-04-30T10:00:00Z"));
    }

    @Test
    void loadIfExistsTreatsMissingFileAsEmpty() throws Exception {
        assertThat(FailureLedger.loadIfExists(ledgerFile)).isEmpty();

        Files.writeString(ledgerFile, "[{");
        assertThatThrownBy(() -> FailureLedger.loadIfExists(ledgerFile)).isInstanceOf(CorruptLedgerException.class);
    }
}
