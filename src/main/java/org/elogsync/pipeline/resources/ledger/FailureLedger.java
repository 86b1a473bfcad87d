package org.elogsync.pipeline.resources.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.elogsync.pipeline.api.contracts.ChangeSet;
import org.elogsync.pipeline.api.contracts.FetchResult;
import org.elogsync.pipeline.api.contracts.LedgerEntry;
import org.elogsync.pipeline.api.resources.CorruptLedgerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Accumulates the terminal failures of one run and persists them as a JSON side file next to
 * the store, so that a later retry can resume exactly those experiments.
 * <p>
 * Recording is thread-safe. A later failure for the same experiment replaces the earlier one.
 * Entries of an earlier ledger can be carried over with {@link #carryOver(List, ChangeSet)}: they
 * are written back on flush but are not part of {@link #entries()}, which only describes this run.
 */
public class FailureLedger {

    private static final Logger log = LoggerFactory.getLogger(FailureLedger.class);
    private static final TypeReference<List<LedgerEntry>> ENTRY_LIST = new TypeReference<>() {};

    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final Map<String, LedgerEntry> entries = new LinkedHashMap<>();
    private final Map<String, LedgerEntry> carried = new LinkedHashMap<>();
    private final Clock clock;

    public FailureLedger() {
        this(Clock.systemUTC());
    }

    public FailureLedger(Clock clock) {
        this.clock = clock;
    }

    /**
     * Records a terminal failure.
     */
    public synchronized void record(FetchResult.Failure failure) {
        entries.put(failure.identifier(), LedgerEntry.of(failure, clock.instant()));
    }

    /**
     * Keeps the entries of an earlier ledger whose experiments are not part of this run. Entries
     * for experiments in {@code changeSet} are dropped: this run either commits them or records
     * a fresh failure.
     *
     * @return Number of entries carried over
     */
    public synchronized int carryOver(List<LedgerEntry> previous, ChangeSet changeSet) {
        int before = carried.size();
        for (LedgerEntry entry : previous) {
            if (!changeSet.contains(entry.experimentId())) {
                carried.put(entry.experimentId(), entry);
            }
        }
        return carried.size() - before;
    }

    public synchronized boolean contains(String experimentId) {
        return entries.containsKey(experimentId);
    }

    public synchronized boolean isEmpty() {
        return entries.isEmpty();
    }

    public synchronized int size() {
        return entries.size();
    }

    /**
     * @return Snapshot of the recorded entries in recording order
     */
    public synchronized List<LedgerEntry> entries() {
        return new ArrayList<>(entries.values());
    }

    /**
     * @return Carried-over entries followed by this run's entries, as written by {@link #flush(Path)}
     */
    public synchronized List<LedgerEntry> pending() {
        Map<String, LedgerEntry> merged = new LinkedHashMap<>(carried);
        merged.keySet().removeAll(entries.keySet());
        merged.putAll(entries);
        return new ArrayList<>(merged.values());
    }

    /**
     * Writes the carried-over and recorded entries to {@code path}, replacing any previous content.
     * If there are none the file is deleted instead.
     *
     * @param path Target file
     * @return {@code true} if a ledger file was written
     * @throws IOException if the file cannot be written or deleted
     */
    public boolean flush(Path path) throws IOException {
        List<LedgerEntry> snapshot = pending();
        if (snapshot.isEmpty()) {
            if (Files.deleteIfExists(path)) {
                log.debug("Removed failure ledger {}, no failures left", path);
            }
            return false;
        }

        Path parent = path.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path tempFile = parent.resolve(path.getFileName() + "." + UUID.randomUUID() + ".tmp");
        objectMapper.writeValue(tempFile.toFile(), snapshot);
        try {
            Files.move(tempFile, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException cleanupEx) {
                log.warn("Failed to clean up temp file after move failure: {}", tempFile);
            }
            throw e;
        }
        log.debug("Wrote {} failed experiments to {}", snapshot.size(), path);
        return true;
    }

    /**
     * Reads a ledger file.
     *
     * @param path The ledger file
     * @return The entries in file order
     * @throws CorruptLedgerException if the file is missing, unreadable or not a ledger
     */
    public static List<LedgerEntry> load(Path path) throws CorruptLedgerException {
        ObjectMapper mapper = new ObjectMapper();
        try {
            List<LedgerEntry> loaded = mapper.readValue(path.toFile(), ENTRY_LIST);
            if (loaded == null) {
                throw new CorruptLedgerException(path, "file contains null instead of a list", null);
            }
            if (loaded.contains(null)) {
                throw new CorruptLedgerException(path, "file contains null entries", null);
            }
            return loaded;
        } catch (NoSuchFileException e) {
            throw new CorruptLedgerException(path, "file not found", e);
        } catch (JsonProcessingException e) {
            throw new CorruptLedgerException(path, e.getOriginalMessage(), e);
        } catch (IOException e) {
            if (!Files.exists(path)) {
                throw new CorruptLedgerException(path, "file not found", e);
            }
            throw new CorruptLedgerException(path, e.getMessage(), e);
        }
    }

    /**
     * Reads a ledger file that may not exist yet.
     *
     * @return The entries, or an empty list if there is no file
     * @throws CorruptLedgerException if the file exists but cannot be read
     */
    public static List<LedgerEntry> loadIfExists(Path path) throws CorruptLedgerException {
        if (!Files.exists(path)) {
            return List.of();
        }
        return load(path);
    }

    /**
     * Reads a ledger file as the input of a retry run.
     *
     * @throws CorruptLedgerException if the file is missing, unreadable or not a ledger
     */
    public static ChangeSet loadChangeSet(Path path) throws CorruptLedgerException {
        List<LedgerEntry> loaded = load(path);
        try {
            return ChangeSet.of(loaded.stream().map(LedgerEntry::experimentId).toList());
        } catch (IllegalArgumentException e) {
            throw new CorruptLedgerException(path, e.getMessage(), e);
        }
    }
}
