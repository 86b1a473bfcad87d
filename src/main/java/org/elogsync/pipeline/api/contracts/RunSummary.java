package org.elogsync.pipeline.api.contracts;

import org.elogsync.pipeline.api.resources.ResourceStatus;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Result of a sync or retry run, as reported to the command line.
 *
 * @param committed  Number of experiments whose bundles were committed to the store
 * @param failures   Terminal failures of this run, as written to the failure ledger
 * @param storePath  The store that was written, or {@code null} for a dry run
 * @param ledgerPath The failure ledger file, or {@code null} if no ledger was written
 * @param cancelled  Whether the run was interrupted before all experiments were dispatched
 * @param resources  Status of the resources the run used, taken after the store was closed
 */
public record RunSummary(int committed, List<LedgerEntry> failures, Path storePath, Path ledgerPath,
                         boolean cancelled, List<ResourceStatus> resources) {

    public RunSummary {
        failures = failures == null ? List.of() : List.copyOf(failures);
        resources = resources == null ? List.of() : List.copyOf(resources);
    }

    public int failed() {
        return failures.size();
    }

    public Optional<Path> ledger() {
        return Optional.ofNullable(ledgerPath);
    }

    public Optional<ResourceStatus> resource(String name) {
        return resources.stream().filter(r -> r.name().equals(name)).findFirst();
    }

    /**
     * @return Resources that recorded operational errors during the run
     */
    public List<ResourceStatus> unhealthyResources() {
        return resources.stream().filter(r -> !r.healthy()).toList();
    }

    public boolean isCompleteSuccess() {
        return failures.isEmpty() && !cancelled;
    }
}
