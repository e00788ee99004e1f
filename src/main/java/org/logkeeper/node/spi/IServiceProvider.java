package org.logkeeper.node.spi;

/**
 * Implemented by processes that expose a service to other processes. The Node injects the
 * exposed instance into every process that declares it in its {@code require} block.
 */
public interface IServiceProvider {

    /**
     * @return The service instance, or {@code null} if this process exposes none.
     */
    Object getExposedService();
}
