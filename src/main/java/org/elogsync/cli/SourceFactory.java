package org.elogsync.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.elogsync.pipeline.api.resources.IResource;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;

/**
 * Creates pipeline resources from configuration blocks of the form
 * <pre>
 * source {
 *   className = "org.elogsync.pipeline.resources.source.ElogHttpSource"
 *   options { ... }
 * }
 * </pre>
 * The class must implement the requested interface and have a public {@code (String, Config)}
 * constructor.
 */
public final class SourceFactory {

    private SourceFactory() {
    }

    /**
     * @param name              A logical name for the resource instance (for logging).
     * @param resourceInterface The interface the resource is expected to implement.
     * @param config            The configuration block, containing 'className' and optional 'options'.
     * @param <T>               The type of the resource interface.
     * @return An instantiated and configured resource.
     * @throws IllegalArgumentException if the block is invalid or the resource cannot be created.
     */
    public static <T extends IResource> T create(String name, Class<T> resourceInterface, Config config) {
        if (!config.hasPath("className")) {
            throw new IllegalArgumentException("Resource configuration '" + name + "' is missing 'className' property.");
        }
        String className = config.getString("className");
        Config options = config.hasPath("options") ? config.getConfig("options") : ConfigFactory.empty();

        Class<?> resourceClass;
        try {
            resourceClass = Class.forName(className);
        } catch (ClassNotFoundException e) {
            throw new IllegalArgumentException("Resource class not found for '" + name + "': " + className, e);
        }
        if (!resourceInterface.isAssignableFrom(resourceClass)) {
            throw new IllegalArgumentException(String.format("Class %s does not implement the required interface %s",
                className, resourceInterface.getName()));
        }
        try {
            Constructor<?> constructor = resourceClass.getConstructor(String.class, Config.class);
            return resourceInterface.cast(constructor.newInstance(name, options));
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IllegalArgumentException("Failed to create resource '" + name + "': " + cause.getMessage(), cause);
        } catch (ReflectiveOperationException e) {
            throw new IllegalArgumentException("Failed to create resource '" + name + "' with class " + className, e);
        }
    }
}
