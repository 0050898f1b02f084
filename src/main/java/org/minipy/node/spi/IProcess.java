package org.minipy.node.spi;

/**
 * A long-running, manageable background process with an explicit lifecycle.
 */
public interface IProcess {

    /**
     * Starts the process. Returns once the process is running.
     */
    void start();

    /**
     * Stops the process and releases its resources. Stopping a stopped process has no effect.
     */
    void stop();
}
