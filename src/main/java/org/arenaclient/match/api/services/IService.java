package org.arenaclient.match.api.services;

/**
 * A long-running unit of work with an explicit lifecycle.
 */
public interface IService {

    /**
     * Lifecycle states of a service.
     */
    enum State {
        STOPPED,
        RUNNING,
        ERROR
    }

    void start();

    void stop();

    State getCurrentState();
}
