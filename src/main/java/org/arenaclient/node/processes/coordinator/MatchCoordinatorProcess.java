package org.arenaclient.node.processes.coordinator;

import java.util.List;
import java.util.Map;

import org.arenaclient.match.api.engine.IEngineFactory;
import org.arenaclient.match.api.resources.IResource;
import org.arenaclient.match.api.services.IService;
import org.arenaclient.match.resources.PortAllocator;
import org.arenaclient.match.resources.engine.EngineSettings;
import org.arenaclient.match.resources.engine.ProcessEngineFactory;
import org.arenaclient.match.resources.results.H2ResultLog;
import org.arenaclient.match.services.InstanceCoordinator;
import org.arenaclient.node.processes.AbstractProcess;
import org.arenaclient.node.spi.IServiceProvider;

import com.typesafe.config.Config;

/**
 * Node process that owns the match machinery: the port pool, the result log, the engine factory
 * and the {@link InstanceCoordinator}. The coordinator is exposed to dependent processes.
 * <p>
 * <strong>Configuration:</strong>
 * <pre>
 * match-coordinator {
 *   className = "org.arenaclient.node.processes.coordinator.MatchCoordinatorProcess"
 *   options {
 *     maxConcurrentSessions = 4
 *     maxQueuedRequests = 16
 *     ports { host = "127.0.0.1", rangeStart = 9100, rangeEnd = 9199 }
 *     session { playerConnectTimeout = 2 minutes, ... }
 *     engine { command = ["..."], endpointPath = "/sc2api", ... }
 *     results { jdbcUrl = "jdbc:h2:./data/results", fallbackReplayDirectory = "replays", ... }
 *   }
 * }
 * </pre>
 */
public class MatchCoordinatorProcess extends AbstractProcess implements IServiceProvider {

    private final PortAllocator ports;
    private final H2ResultLog resultLog;
    private final InstanceCoordinator coordinator;

    public MatchCoordinatorProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        this(processName, dependencies, options, null);
    }

    /**
     * Constructs the process with a custom engine factory.
     *
     * @param processName   The name of this process instance.
     * @param dependencies  Injected dependencies (none required).
     * @param options       Process options.
     * @param engineFactory Engine factory, or {@code null} to launch engines from {@code engine}.
     */
    MatchCoordinatorProcess(final String processName, final Map<String, Object> dependencies, final Config options,
                            final IEngineFactory engineFactory) {
        super(processName, dependencies, options);
        // Validate engine settings before any resource is opened.
        EngineSettings engineSettings = engineFactory == null ? EngineSettings.fromConfig(options.getConfig("engine")) : null;
        this.ports = new PortAllocator(processName + "-ports", options.getConfig("ports"));
        this.resultLog = new H2ResultLog(processName + "-results", options.getConfig("results"));
        IEngineFactory factory = engineFactory != null
            ? engineFactory
            : new ProcessEngineFactory(engineSettings, ports.getHost());
        Map<String, List<IResource>> resources = Map.of(
            "ports", List.of(ports),
            "results", List.of(resultLog));
        this.coordinator = new InstanceCoordinator(processName, options, resources, factory);
    }

    @Override
    public Object getExposedService() {
        return coordinator;
    }

    @Override
    public void start() {
        coordinator.start();
    }

    @Override
    public void stop() {
        try {
            if (coordinator.getCurrentState() != IService.State.STOPPED
                && coordinator.getCurrentState() != IService.State.ERROR) {
                coordinator.stop();
            }
        } finally {
            resultLog.close();
        }
        log.info("Match coordinator '{}' stopped", processName);
    }

    public InstanceCoordinator getCoordinator() {
        return coordinator;
    }
}
