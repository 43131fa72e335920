package org.arenaclient.node.processes;

import java.util.Map;

import org.arenaclient.node.spi.IProcess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Base class for node processes. Holds the process name, the injected dependencies and the
 * process options.
 */
public abstract class AbstractProcess implements IProcess {

    protected final Logger log = LoggerFactory.getLogger(this.getClass());
    protected final String processName;
    protected final Map<String, Object> dependencies;
    protected final Config options;

    /**
     * Constructs the process.
     *
     * @param processName  The name of this process instance from the configuration.
     * @param dependencies Services exposed by required processes, keyed by their {@code require} key.
     * @param options      The {@code options} block of this process.
     */
    protected AbstractProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        this.processName = processName;
        this.dependencies = dependencies;
        this.options = options;
    }

    /**
     * Looks up a required dependency and checks its type.
     *
     * @param key  The {@code require} key.
     * @param type The expected type.
     * @param <T>  The expected type.
     * @return the dependency.
     * @throws IllegalStateException if the dependency is missing or has the wrong type.
     */
    protected <T> T getDependency(final String key, final Class<T> type) {
        final Object dependency = dependencies.get(key);
        if (dependency == null) {
            throw new IllegalStateException(String.format(
                "Process '%s' requires dependency '%s' but none was injected", processName, key));
        }
        if (!type.isInstance(dependency)) {
            throw new IllegalStateException(String.format(
                "Dependency '%s' of process '%s' is a %s, expected %s",
                key, processName, dependency.getClass().getName(), type.getName()));
        }
        return type.cast(dependency);
    }
}
