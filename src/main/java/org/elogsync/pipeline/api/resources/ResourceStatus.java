package org.elogsync.pipeline.api.resources;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of a resource's health, metrics and recorded errors at the end of a run.
 *
 * @param name    The resource name (from {@link IResource#getResourceName()}).
 * @param healthy Whether the resource reports itself as healthy (from {@link IMonitorable#isHealthy()}).
 * @param metrics The resource metrics.
 * @param errors  The operational errors recorded by the resource.
 */
public record ResourceStatus(
    String name,
    boolean healthy,
    Map<String, Number> metrics,
    List<OperationalError> errors
) {

    public ResourceStatus {
        metrics = metrics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * Takes a snapshot of {@code resource}. Resources that are not {@link IMonitorable} are
     * reported healthy with no metrics.
     */
    public static ResourceStatus of(IResource resource) {
        if (resource instanceof IMonitorable monitorable) {
            return new ResourceStatus(resource.getResourceName(), monitorable.isHealthy(),
                monitorable.getMetrics(), monitorable.getErrors());
        }
        return new ResourceStatus(resource.getResourceName(), true, Map.of(), List.of());
    }
}
