package org.arenaclient.node;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.arenaclient.node.spi.IProcess;
import org.arenaclient.node.spi.IServiceProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigObject;

/**
 * Hosts the configured {@link IProcess} instances of one arenaclient node.
 * <p>
 * Processes are declared under {@code node.processes}:
 * <pre>
 * node.processes {
 *   match-coordinator {
 *     className = "org.arenaclient.node.processes.coordinator.MatchCoordinatorProcess"
 *     options { ... }
 *   }
 *   gateway {
 *     className = "org.arenaclient.node.processes.gateway.ConnectionGatewayProcess"
 *     require { coordinator = "match-coordinator" }
 *     options { ... }
 *   }
 * }
 * </pre>
 * Each {@code require} entry maps a local key to the name of another process. Processes are
 * constructed in topological order so that the service exposed by a required process (see
 * {@link IServiceProvider}) can be injected into the constructor of its dependents. Processes
 * are started in the same order and stopped in reverse.
 * <p>
 * A process that cannot be constructed is logged and skipped; its dependents are skipped too.
 */
public class Node {

    private static final Logger log = LoggerFactory.getLogger(Node.class);
    private static final String PROCESSES_PATH = "node.processes";

    private final LinkedHashMap<String, IProcess> processes = new LinkedHashMap<>();
    private final List<String> startedProcesses = new ArrayList<>();

    /**
     * Creates the node and instantiates all configured processes.
     *
     * @param config The fully resolved application configuration.
     */
    public Node(final Config config) {
        if (!config.hasPath(PROCESSES_PATH)) {
            log.warn("Configuration path '{}' not found. No processes will be loaded.", PROCESSES_PATH);
            return;
        }

        final Config processesConfig = config.getConfig(PROCESSES_PATH);
        final Map<String, Config> declarations = new LinkedHashMap<>();
        for (final String name : config.getObject(PROCESSES_PATH).keySet()) {
            declarations.put(name, processesConfig.getConfig(quote(name)));
        }

        for (final String name : topologicalOrder(declarations)) {
            final Config declaration = declarations.get(name);
            try {
                processes.put(name, instantiate(name, declaration));
                log.debug("Initialized process '{}'", name);
            } catch (Exception e) {
                log.error("Failed to initialize process '{}'. Skipping this process.", name);
                log.debug("Initialization failure of '{}':", name, e);
            }
        }
    }

    /**
     * Starts all processes in dependency order. A failing process is logged and the remaining
     * processes are still started.
     */
    public void start() {
        if (processes.isEmpty()) {
            log.warn("No processes configured to start. The node will be idle.");
            return;
        }
        for (final Map.Entry<String, IProcess> entry : processes.entrySet()) {
            try {
                entry.getValue().start();
                startedProcesses.add(entry.getKey());
                log.debug("Started process '{}'", entry.getKey());
            } catch (Exception e) {
                log.error("Failed to start process '{}'. The node may be unstable.", entry.getKey());
                log.debug("Start failure of '{}':", entry.getKey(), e);
            }
        }
        log.info("Node started with processes {}", startedProcesses);
    }

    /**
     * Stops all started processes in reverse order. Idempotent.
     */
    public void stop() {
        final List<String> toStop = new ArrayList<>(startedProcesses);
        Collections.reverse(toStop);
        startedProcesses.clear();
        for (final String name : toStop) {
            try {
                processes.get(name).stop();
                log.debug("Stopped process '{}'", name);
            } catch (Exception e) {
                log.error("Error while stopping process '{}'.", name);
                log.debug("Stop failure of '{}':", name, e);
            }
        }
    }

    /**
     * Returns a constructed process by its configured name.
     *
     * @param name The process name.
     * @return the process, or empty if it was not configured or failed to initialize.
     */
    public Optional<IProcess> getProcess(final String name) {
        return Optional.ofNullable(processes.get(name));
    }

    private IProcess instantiate(final String name, final Config declaration) throws ReflectiveOperationException {
        final String className = declaration.getString("className");
        final Class<?> clazz = Class.forName(className);
        if (!IProcess.class.isAssignableFrom(clazz)) {
            throw new IllegalArgumentException(className + " does not implement " + IProcess.class.getName());
        }

        final Map<String, Object> dependencies = new HashMap<>();
        if (declaration.hasPath("require")) {
            final Config require = declaration.getConfig("require");
            for (final String key : declaration.getObject("require").keySet()) {
                final String requiredName = require.getString(quote(key));
                final IProcess required = processes.get(requiredName);
                if (required == null) {
                    throw new IllegalStateException(String.format(
                        "Process '%s' requires '%s' which is not available", name, requiredName));
                }
                dependencies.put(key, required instanceof IServiceProvider provider
                    ? provider.getExposedService()
                    : required);
            }
        }

        final Config options = declaration.hasPath("options") ? declaration.getConfig("options") : ConfigFactory.empty();
        final Constructor<?> constructor = clazz.getDeclaredConstructor(String.class, Map.class, Config.class);
        constructor.setAccessible(true);
        try {
            return (IProcess) constructor.newInstance(name, dependencies, options);
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }

    private static List<String> topologicalOrder(final Map<String, Config> declarations) {
        final List<String> order = new ArrayList<>();
        final Set<String> visited = new HashSet<>();
        final Set<String> visiting = new HashSet<>();
        for (final String name : declarations.keySet()) {
            visit(name, declarations, visited, visiting, order);
        }
        return order;
    }

    private static void visit(final String name, final Map<String, Config> declarations, final Set<String> visited,
                              final Set<String> visiting, final List<String> order) {
        if (visited.contains(name) || !declarations.containsKey(name)) {
            return;
        }
        if (!visiting.add(name)) {
            throw new IllegalStateException("Cyclic 'require' dependency involving process '" + name + "'");
        }
        final Config declaration = declarations.get(name);
        if (declaration.hasPath("require")) {
            final ConfigObject require = declaration.getObject("require");
            for (final Object requiredName : require.unwrapped().values()) {
                visit(String.valueOf(requiredName), declarations, visited, visiting, order);
            }
        }
        visiting.remove(name);
        visited.add(name);
        order.add(name);
    }

    private static String quote(final String key) {
        return "\"" + key + "\"";
    }
}
