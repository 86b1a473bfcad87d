package org.elogsync.pipeline.api.resources;

/**
 * Base interface for all resources used by the sync pipeline.
 */
public interface IResource {

    /**
     * Returns the configured name of this resource instance.
     *
     * @return The resource name.
     */
    String getResourceName();
}
