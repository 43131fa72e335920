package org.arenaclient.match.resources.engine;

import java.net.URI;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.arenaclient.match.api.engine.EngineLaunchException;
import org.arenaclient.match.api.engine.EngineLinkException;
import org.arenaclient.match.api.engine.IEngine;
import org.arenaclient.match.model.MatchConfig;
import org.arenaclient.match.model.PlayerSlot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An engine running as a child process, reached over one WebSocket control link per slot.
 * <p>
 * {@link #start()} spawns the process and connects both links, retrying until the startup
 * window closes. An exit of the process fails both links; unless it was caused by
 * {@link #terminate(Duration)}, the registered exit callbacks run as well.
 */
public class ProcessEngine implements IEngine {

    private static final Logger log = LoggerFactory.getLogger(ProcessEngine.class);

    private final EngineProcessLauncher launcher;
    private final EngineSettings settings;
    private final HttpClient httpClient;
    private final MatchConfig config;
    private final String host;
    private final int port;
    private final Path workDirectory;
    private final Map<PlayerSlot, WebSocketEngineLink> links = new EnumMap<>(PlayerSlot.class);
    private final List<Runnable> exitCallbacks = new CopyOnWriteArrayList<>();
    private final AtomicBoolean terminating = new AtomicBoolean();
    private volatile Process process;

    ProcessEngine(EngineProcessLauncher launcher, EngineSettings settings, HttpClient httpClient, MatchConfig config,
                  String host, int port, Path workDirectory) {
        this.launcher = launcher;
        this.settings = settings;
        this.httpClient = httpClient;
        this.config = config;
        this.host = host;
        this.port = port;
        this.workDirectory = workDirectory;
    }

    @Override
    public void start() {
        if (process != null) {
            throw new IllegalStateException("Engine on port " + port + " was already started");
        }
        Process started = launcher.launch(config, host, port, workDirectory);
        process = started;
        started.onExit().thenRun(this::handleExit);

        URI endpoint = URI.create("ws://" + host + ":" + port + settings.endpointPath());
        long deadline = System.nanoTime() + settings.startupTimeout().toNanos();
        for (PlayerSlot slot : PlayerSlot.values()) {
            WebSocketEngineLink link = connect(endpoint, deadline);
            synchronized (links) {
                links.put(slot, link);
            }
        }
        if (!started.isAlive()) {
            // exited between the last connect and now; handleExit may have missed the links
            failLinks(new EngineLinkException("Engine exited during startup with code " + started.exitValue()));
            throw new EngineLaunchException("Engine exited during startup with code " + started.exitValue());
        }
        log.debug("Engine pid {} reachable at {}", started.pid(), endpoint);
    }

    private WebSocketEngineLink connect(URI endpoint, long deadline) {
        Duration retry = settings.connectRetryInterval();
        while (true) {
            Process current = process;
            if (!current.isAlive()) {
                throw new EngineLaunchException("Engine exited during startup with code " + current.exitValue());
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new EngineLaunchException("Engine endpoint " + endpoint + " not reachable within "
                    + settings.startupTimeout().toSeconds() + "s");
            }
            try {
                return WebSocketEngineLink.connect(httpClient, endpoint, settings.maxFrameSize(), Duration.ofNanos(remaining))
                    .get(remaining, TimeUnit.NANOSECONDS);
            } catch (ExecutionException | TimeoutException e) {
                log.trace("Engine endpoint {} not ready yet: {}", endpoint, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new EngineLaunchException("Interrupted while waiting for engine endpoint " + endpoint, e);
            }
            try {
                Thread.sleep(Math.min(retry.toMillis(), Math.max(1, TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime()))));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new EngineLaunchException("Interrupted while waiting for engine endpoint " + endpoint, e);
            }
        }
    }

    @Override
    public boolean isAlive() {
        Process current = process;
        return current != null && current.isAlive();
    }

    @Override
    public CompletableFuture<Void> sendFrame(PlayerSlot slot, byte[] frame) {
        WebSocketEngineLink link = link(slot);
        if (link == null) {
            return CompletableFuture.failedFuture(new EngineLinkException("No control link for slot " + slot.number()));
        }
        return link.send(frame);
    }

    @Override
    public CompletableFuture<byte[]> recvFrame(PlayerSlot slot) {
        WebSocketEngineLink link = link(slot);
        if (link == null) {
            return CompletableFuture.failedFuture(new EngineLinkException("No control link for slot " + slot.number()));
        }
        return link.next();
    }

    @Override
    public void onExit(Runnable callback) {
        exitCallbacks.add(callback);
    }

    @Override
    public void terminate(Duration grace) {
        terminating.set(true);
        synchronized (links) {
            links.values().forEach(WebSocketEngineLink::close);
        }
        Process current = process;
        if (current != null) {
            EngineProcessLauncher.terminate(current, grace);
            log.debug("Engine on port {} terminated (alive={})", port, current.isAlive());
        }
    }

    private void handleExit() {
        Process current = process;
        int exitCode = current.exitValue();
        failLinks(new EngineLinkException("Engine process exited with code " + exitCode));
        if (terminating.get()) {
            return;
        }
        log.warn("Engine on port {} exited unexpectedly with code {}", port, exitCode);
        for (Runnable callback : exitCallbacks) {
            callback.run();
        }
    }

    private void failLinks(EngineLinkException cause) {
        synchronized (links) {
            links.values().forEach(link -> link.fail(cause));
        }
    }

    private WebSocketEngineLink link(PlayerSlot slot) {
        synchronized (links) {
            return links.get(slot);
        }
    }
}
