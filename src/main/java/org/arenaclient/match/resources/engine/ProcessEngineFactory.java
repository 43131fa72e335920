package org.arenaclient.match.resources.engine;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Duration;

import org.arenaclient.match.api.engine.IEngine;
import org.arenaclient.match.api.engine.IEngineFactory;
import org.arenaclient.match.model.MatchConfig;

/**
 * Creates {@link ProcessEngine}s that share one launcher and one HTTP client.
 */
public class ProcessEngineFactory implements IEngineFactory {

    private final EngineSettings settings;
    private final EngineProcessLauncher launcher;
    private final String host;
    private final HttpClient httpClient;

    /**
     * @param settings Engine launch settings.
     * @param host     Host the engines bind, normally the port allocator's host.
     */
    public ProcessEngineFactory(EngineSettings settings, String host) {
        this.settings = settings;
        this.launcher = new EngineProcessLauncher(settings.command());
        this.host = host;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @Override
    public IEngine create(MatchConfig config, int port, Path workDirectory) {
        return new ProcessEngine(launcher, settings, httpClient, config, host, port, workDirectory);
    }

    public EngineSettings getSettings() {
        return settings;
    }
}
