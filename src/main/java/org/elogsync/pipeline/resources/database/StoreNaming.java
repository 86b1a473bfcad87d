package org.elogsync.pipeline.resources.database;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Naming scheme of store files: {@code <prefix><yyyy_MMdd_HHmm>.db}, e.g. {@code elog_2026_1018_0930.db}.
 * A second store in the same minute gets a seconds suffix, {@code elog_2026_1018_0930_42.db}.
 * Names sort chronologically, so the latest store is the lexicographically greatest name.
 */
public final class StoreNaming {

    private static final Logger log = LoggerFactory.getLogger(StoreNaming.class);
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy_MMdd_HHmm");
    private static final DateTimeFormatter SECONDS = DateTimeFormatter.ofPattern("ss");

    private final String prefix;
    private final Pattern namePattern;
    private final Clock clock;

    public StoreNaming(String prefix) {
        this(prefix, Clock.systemDefaultZone());
    }

    public StoreNaming(String prefix, Clock clock) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("Store prefix must not be blank");
        }
        this.prefix = prefix;
        this.namePattern = Pattern.compile("^" + Pattern.quote(prefix) + "\\d{4}_\\d{4}_\\d{4}(_\\d{2})?\\.db$");
        this.clock = clock;
    }

    /**
     * @return A store file name for the current time
     */
    public String newStoreName() {
        return nameAt(LocalDateTime.now(clock));
    }

    private String nameAt(LocalDateTime time) {
        return prefix + time.format(TIMESTAMP) + ".db";
    }

    /**
     * Path of a new store in {@code directory}. If the minute's name is taken, the seconds are
     * appended. If that name is taken too, it is returned anyway and the caller decides.
     */
    public Path newStorePath(Path directory) {
        LocalDateTime now = LocalDateTime.now(clock);
        Path store = directory.resolve(nameAt(now));
        if (!Files.exists(store)) {
            return store;
        }
        Path withSeconds = directory.resolve(prefix + now.format(TIMESTAMP) + "_" + now.format(SECONDS) + ".db");
        log.debug("Store {} already exists, using {}", store.getFileName(), withSeconds.getFileName());
        return withSeconds;
    }

    public boolean isStoreName(String fileName) {
        return namePattern.matcher(fileName).matches();
    }

    /**
     * Locates the latest store in a directory.
     *
     * @param directory Directory to search, may not exist
     * @return The store with the greatest name, or empty if none exists
     * @throws IOException if the directory cannot be listed
     */
    public Optional<Path> findLatest(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            return Optional.empty();
        }
        try (Stream<Path> entries = Files.list(directory)) {
            Optional<Path> latest = entries
                .filter(Files::isRegularFile)
                .filter(p -> isStoreName(p.getFileName().toString()))
                .max(Comparator.comparing(p -> p.getFileName().toString()));
            log.debug("Latest store in {}: {}", directory, latest.map(Path::getFileName).orElse(null));
            return latest;
        }
    }

    public String getPrefix() {
        return prefix;
    }
}
