package org.logkeeper.node.spi;

/**
 * A long-running, manageable process within the Node.
 */
public interface IProcess {

    /**
     * Starts the process. Must not block if the process runs continuously.
     */
    void start();

    /**
     * Stops the process gracefully and releases its resources.
     */
    void stop();
}
