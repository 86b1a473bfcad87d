package org.elogsync.pipeline.api.resources;

import java.util.List;
import java.util.Map;

/**
 * Interface for components that expose metrics and operational errors.
 */
public interface IMonitorable {

    /**
     * Returns a snapshot of the component's metrics.
     *
     * @return Map of metric names to their current values.
     */
    Map<String, Number> getMetrics();

    /**
     * Returns the operational errors recorded by the component.
     *
     * @return A copy of the recorded errors.
     */
    List<OperationalError> getErrors();

    /**
     * @return {@code true} if no operational errors are recorded.
     */
    boolean isHealthy();
}
