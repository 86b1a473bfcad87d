package org.elogsync.pipeline.services;

import org.elogsync.pipeline.api.contracts.ChangeSet;
import org.elogsync.pipeline.api.source.IRemoteSource;
import org.elogsync.pipeline.api.source.SourceUnavailableException;
import org.elogsync.pipeline.utils.ExcludePatterns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Decides which experiments a run has to fetch: those the remote source reports as changed
 * within the lookback window, minus those matching an exclude pattern.
 * <p>
 * Does not retry; the remote source applies its own listing retry budget.
 */
public class ChangeSetResolver {

    private static final Logger log = LoggerFactory.getLogger(ChangeSetResolver.class);

    private final IRemoteSource source;

    public ChangeSetResolver(IRemoteSource source) {
        this.source = Objects.requireNonNull(source, "source must not be null");
    }

    /**
     * @param window   Lookback window, must not be negative
     * @param excludes Identifiers matching any of these patterns are dropped
     * @return The de-duplicated, filtered change set
     * @throws SourceUnavailableException if the listing cannot be obtained
     * @throws InterruptedException       if interrupted while the source waits between attempts
     */
    public ChangeSet resolve(Duration window, ExcludePatterns excludes)
            throws SourceUnavailableException, InterruptedException {
        if (window.isNegative()) {
            throw new IllegalArgumentException("Lookback window must not be negative: " + window);
        }
        log.debug("Listing experiments updated in the last {} hours", window.toHours());
        List<String> listed = source.listChanged(window);

        List<String> kept = new ArrayList<>(listed.size());
        int excluded = 0;
        for (String id : listed) {
            if (id == null || id.isBlank()) {
                continue;
            }
            if (excludes.excludes(id)) {
                excluded++;
            } else {
                kept.add(id);
            }
        }
        ChangeSet changeSet = ChangeSet.of(kept);
        if (excluded > 0) {
            log.info("Excluded {} experiments by patterns {}", excluded, excludes);
        }
        log.info("Resolved {} experiments to sync ({} listed)", changeSet.size(), listed.size());
        return changeSet;
    }
}
