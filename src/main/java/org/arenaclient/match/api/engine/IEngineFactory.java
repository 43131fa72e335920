package org.arenaclient.match.api.engine;

import java.nio.file.Path;

import org.arenaclient.match.model.MatchConfig;

/**
 * Creates engine handles for match sessions.
 */
@FunctionalInterface
public interface IEngineFactory {

    /**
     * Creates an engine bound to a leased port. The engine is not started.
     *
     * @param config        The match configuration.
     * @param port          The leased port.
     * @param workDirectory Directory owned by the session.
     * @return a new engine handle.
     */
    IEngine create(MatchConfig config, int port, Path workDirectory);
}
