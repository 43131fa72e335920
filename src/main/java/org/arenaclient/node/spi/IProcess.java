package org.arenaclient.node.spi;

/**
 * A lifecycle unit managed by the {@link org.arenaclient.node.Node}.
 * <p>
 * Implementations are instantiated reflectively and must provide a public constructor with the
 * signature {@code (String processName, Map<String, Object> dependencies, Config options)}.
 */
public interface IProcess {

    /**
     * Starts the process. Called once, in dependency order.
     */
    void start();

    /**
     * Stops the process. Called once, in reverse dependency order.
     */
    void stop();
}
