package org.arenaclient.match.services;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.arenaclient.match.api.resources.IMonitorable;
import org.arenaclient.match.api.resources.IResource;
import org.arenaclient.match.api.resources.OperationalError;
import org.arenaclient.match.api.services.IService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Base class for services that own a dedicated thread, such as the instance coordinator's
 * dispatch loop. Provides lifecycle state handling, resource lookup and bounded tracking of
 * transient errors. Subclasses implement {@link #run()}.
 */
public abstract class AbstractService implements IService, IMonitorable {

    protected final Logger log = LoggerFactory.getLogger(this.getClass());
    protected final String serviceName;
    protected final Config options;
    protected final Map<String, List<IResource>> resources;
    private final AtomicReference<State> currentState = new AtomicReference<>(State.STOPPED);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();
    private final int shutdownTimeoutSeconds;
    private Thread serviceThread;

    /**
     * Constructs the service.
     *
     * @param name      The name of the service instance, also used as its thread name.
     * @param options   The configuration for this service.
     * @param resources Resources keyed by port name.
     */
    protected AbstractService(String name, Config options, Map<String, List<IResource>> resources) {
        this.serviceName = name;
        this.options = options;
        this.resources = resources;
        this.shutdownTimeoutSeconds = options.hasPath("shutdownTimeout")
            ? options.getInt("shutdownTimeout")
            : 5;
    }

    /**
     * Maximum number of errors kept in memory. Oldest errors are dropped first.
     */
    protected int getMaxErrors() {
        return 1000;
    }

    @Override
    public final void start() {
        if (!currentState.compareAndSet(State.STOPPED, State.RUNNING)) {
            throw new IllegalStateException(String.format("Cannot start service '%s' as it is already in state %s", serviceName, getCurrentState()));
        }
        stopRequested.set(false);
        serviceThread = new Thread(this::runService);
        serviceThread.setName(serviceName);
        serviceThread.start();
        logStarted();
    }

    /**
     * Logs service startup. Services override this to include their key settings.
     */
    protected void logStarted() {
        log.info("{} started", this.getClass().getSimpleName());
    }

    @Override
    public final void stop() {
        State state = getCurrentState();
        if (state != State.RUNNING) {
            throw new IllegalStateException(String.format("Cannot stop service '%s' as it is in state %s", serviceName, state));
        }

        stopRequested.set(true);

        if (serviceThread != null) {
            try {
                serviceThread.interrupt();
                serviceThread.join(shutdownTimeoutSeconds * 1000L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("{} interrupted while waiting for service shutdown", this.getClass().getSimpleName());
            }
            if (serviceThread.isAlive()) {
                log.error("{} thread did not stop within {} seconds! Forcing ERROR state.",
                    this.getClass().getSimpleName(), shutdownTimeoutSeconds);
                currentState.set(State.ERROR);
                return;
            }
        }

        if (getCurrentState() != State.STOPPED && getCurrentState() != State.ERROR) {
            currentState.set(State.STOPPED);
        }
        onStopped();
        log.debug("{} stopped", this.getClass().getSimpleName());
    }

    /**
     * Hook called on the stopping thread after the service thread has terminated.
     */
    protected void onStopped() {
        // Default: nothing to release
    }

    @Override
    public State getCurrentState() {
        return currentState.get();
    }

    private void runService() {
        try {
            run();
        } catch (InterruptedException e) {
            log.debug("Service thread interrupted, shutting down.");
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("{} stopped with ERROR due to {}", this.getClass().getSimpleName(), e.getClass().getSimpleName());
            log.debug("Exception details:", e);
            currentState.set(State.ERROR);
        } finally {
            if (getCurrentState() != State.ERROR) {
                currentState.set(State.STOPPED);
            }
            log.debug("Service thread for {} has terminated.", this.getClass().getSimpleName());
        }
    }

    /**
     * The main loop of the service, executed on its dedicated thread.
     * <p>
     * Implementations check {@link #isStopRequested()} on every iteration and use timeouts on
     * blocking calls. Transient errors are logged with
     * {@code log.warn} and tracked with {@link #recordError(String, String, String)}; fatal
     * errors are logged with {@code log.error} (no stack trace) and thrown, which moves the
     * service to {@link State#ERROR}. {@link InterruptedException} is a clean shutdown.
     *
     * @throws InterruptedException if the thread is interrupted during shutdown.
     */
    protected abstract void run() throws InterruptedException;

    /**
     * @return {@code true} once {@link #stop()} has been called.
     */
    protected boolean isStopRequested() {
        return stopRequested.get();
    }

    /**
     * Gets the single resource bound to a port, checking its type.
     *
     * @param portName     The name of the resource port.
     * @param expectedType The expected resource type.
     * @param <T>          The expected resource type.
     * @return the resource.
     * @throws IllegalStateException if the port is missing, not bound to exactly one resource,
     *                               or bound to a resource of another type.
     */
    protected <T> T getRequiredResource(String portName, Class<T> expectedType) {
        List<IResource> resourceList = resources.get(portName);
        if (resourceList == null) {
            throw new IllegalStateException("Resource port '" + portName + "' is not configured.");
        }
        if (resourceList.size() != 1) {
            throw new IllegalStateException("Resource port '" + portName + "' has " + resourceList.size() + " resources, but exactly one is required.");
        }
        IResource resource = resourceList.get(0);
        if (!expectedType.isInstance(resource)) {
            throw new IllegalStateException("Resource at port '" + portName + "' is of type " + resource.getClass().getName() + ", but expected type is " + expectedType.getName());
        }
        return expectedType.cast(resource);
    }

    /**
     * Records a transient error. Use only for errors the service survives.
     *
     * @param code    Error code for categorization (e.g. "RESULT_PERSIST_FAILED").
     * @param message Human-readable error message.
     * @param details Additional context.
     */
    protected void recordError(String code, String message, String details) {
        errors.add(new OperationalError(Instant.now(), code, message, details));
        int maxErrors = getMaxErrors();
        while (errors.size() > maxErrors) {
            errors.pollFirst();
        }
    }

    @Override
    public List<OperationalError> getErrors() {
        return new ArrayList<>(errors);
    }

    @Override
    public boolean isHealthy() {
        if (getCurrentState() == State.ERROR) return false;
        return errors.isEmpty();
    }

    @Override
    public final Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("error_count", errors.size());
        addCustomMetrics(metrics);
        return metrics;
    }

    /**
     * Hook for subclasses to add service-specific metrics. Call {@code super} first.
     *
     * @param metrics Mutable map that already contains the base metrics.
     */
    protected void addCustomMetrics(Map<String, Number> metrics) {
        // Default: no custom metrics
    }
}
