package org.arenaclient.match.api.resources;

import java.util.List;
import java.util.Map;

/**
 * Components that expose metrics and transient operational errors.
 */
public interface IMonitorable {

    /**
     * @return a snapshot of metric names to values.
     */
    Map<String, Number> getMetrics();

    /**
     * @return a copy of the recorded operational errors, oldest first.
     */
    List<OperationalError> getErrors();

    /**
     * @return {@code true} if the component runs without recorded errors.
     */
    boolean isHealthy();
}
