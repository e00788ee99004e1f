package org.logkeeper.ingest.api.resources;

/**
 * A named, shareable component used by services (queues, trackers, stores).
 */
public interface IResource {

    /**
     * @return The unique name of this resource instance.
     */
    String getResourceName();
}
