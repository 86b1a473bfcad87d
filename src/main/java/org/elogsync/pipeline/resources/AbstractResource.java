package org.elogsync.pipeline.resources;

import com.typesafe.config.Config;
import org.elogsync.pipeline.api.resources.IMonitorable;
import org.elogsync.pipeline.api.resources.IResource;
import org.elogsync.pipeline.api.resources.OperationalError;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Base class for pipeline resources: name and option handling plus error and metrics tracking.
 * <p>
 * <strong>Error handling guidelines for resources:</strong>
 * <ul>
 *   <li>Errors the resource survives (a rolled-back batch, a rejected request):
 *       {@code log.warn(...)} without the exception, {@link #recordError(String, String, String)},
 *       and throw or return a failure value if the caller needs to react.</li>
 *   <li>Fatal errors (store cannot be opened): {@code log.error(...)} without the exception and throw.</li>
 *   <li>Retry attempts and interruption during shutdown: {@code log.debug(...)} only.</li>
 * </ul>
 * Stack traces go to DEBUG.
 */
public abstract class AbstractResource implements IResource, IMonitorable {

    protected final String resourceName;
    protected final Config options;

    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();

    /**
     * @param name    The name of the resource instance.
     * @param options The configuration block of this resource.
     */
    protected AbstractResource(String name, Config options) {
        this.resourceName = Objects.requireNonNull(name, "Resource name cannot be null");
        this.options = Objects.requireNonNull(options, "Resource options cannot be null");
    }

    /**
     * Maximum number of errors kept in memory. Oldest errors are dropped first.
     */
    protected int getMaxErrors() {
        return 1000;
    }

    @Override
    public String getResourceName() {
        return resourceName;
    }

    public Config getOptions() {
        return options;
    }

    /**
     * Records an operational error the resource continues to function after.
     *
     * @param code    Error category (e.g. "HTTP_5XX", "BATCH_ROLLBACK")
     * @param message Human-readable message
     * @param details Additional context
     */
    protected void recordError(String code, String message, String details) {
        errors.add(new OperationalError(Instant.now(), code, message, details));
        int maxErrors = getMaxErrors();
        while (errors.size() > maxErrors) {
            errors.pollFirst();
        }
    }

    @Override
    public List<OperationalError> getErrors() {
        return new ArrayList<>(errors);
    }

    @Override
    public boolean isHealthy() {
        return errors.isEmpty();
    }

    /**
     * Returns base metrics ({@code error_count}) followed by the subclass metrics.
     */
    @Override
    public final Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("error_count", errors.size());
        addCustomMetrics(metrics);
        return metrics;
    }

    /**
     * Hook for subclasses to add resource-specific metrics. Call {@code super.addCustomMetrics(metrics)} first.
     *
     * @param metrics Mutable map already containing the base metrics
     */
    protected void addCustomMetrics(Map<String, Number> metrics) {
        // no custom metrics by default
    }
}
