package org.arenaclient.match.services;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.arenaclient.match.api.connection.IConnection;
import org.arenaclient.match.api.engine.IEngineFactory;
import org.arenaclient.match.api.resources.IResource;
import org.arenaclient.match.api.results.IResultLog;
import org.arenaclient.match.model.MatchConfig;
import org.arenaclient.match.model.PlayerSlot;
import org.arenaclient.match.protocol.RequestFrame;
import org.arenaclient.match.protocol.SupervisorMessages;
import org.arenaclient.match.resources.PortAllocator;
import org.arenaclient.match.resources.results.ReplayWriter;
import org.arenaclient.match.session.MatchRequest;
import org.arenaclient.match.session.MatchSession;
import org.arenaclient.match.session.SessionSettings;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Admits match requests and owns the registry of live sessions.
 * <p>
 * Requests wait in a bounded FIFO queue. The dispatch thread admits the oldest request whenever
 * fewer than {@code maxConcurrentSessions} sessions are live; a session stays live until its
 * {@link MatchSession#run()} has returned, which includes terminating its engine and releasing
 * its port. A request arriving at a full queue is rejected at once.
 * <p>
 * Bots are routed to sessions awaiting players: first by the player name of their join request,
 * then by a handshake hint, then to the first free slot of the oldest awaiting session.
 * <p>
 * <strong>Resources:</strong>
 * <ul>
 *   <li>{@code ports}: the {@link PortAllocator} shared by all sessions.</li>
 *   <li>{@code results}: the {@link IResultLog} completed matches are appended to.</li>
 * </ul>
 */
public class InstanceCoordinator extends AbstractService {

    private static final long POLL_INTERVAL_MS = 100;
    private static final int ROUTE_ATTEMPTS = 3;

    private final PortAllocator ports;
    private final IResultLog resultLog;
    private final IEngineFactory engineFactory;
    private final SessionSettings sessionSettings;
    private final ResultAggregator aggregator;
    private final int maxConcurrentSessions;
    private final int maxQueuedRequests;
    private final LinkedBlockingQueue<MatchRequest> queue;
    private final Semaphore sessionPermits;
    private final Map<Long, MatchSession> sessions = new LinkedHashMap<>();
    private final Object registryLock = new Object();
    private final ExecutorService sessionExecutor;
    private final AtomicLong requestIds = new AtomicLong();
    private final AtomicLong sessionIds = new AtomicLong();
    private final AtomicLong sessionsStarted = new AtomicLong();
    private final AtomicLong sessionsCompleted = new AtomicLong();
    private final AtomicLong sessionsRejected = new AtomicLong();

    /**
     * @param name          Service name, also the dispatch thread name.
     * @param options       Coordinator options.
     * @param resources     Resources keyed by port name, see class documentation.
     * @param engineFactory Factory for engine instances.
     */
    public InstanceCoordinator(String name, Config options, Map<String, List<IResource>> resources,
                               IEngineFactory engineFactory) {
        super(name, options, resources);
        this.ports = getRequiredResource("ports", PortAllocator.class);
        this.resultLog = getRequiredResource("results", IResultLog.class);
        this.engineFactory = engineFactory;
        this.maxConcurrentSessions = options.hasPath("maxConcurrentSessions") ? options.getInt("maxConcurrentSessions") : 4;
        this.maxQueuedRequests = options.hasPath("maxQueuedRequests") ? options.getInt("maxQueuedRequests") : 16;
        if (maxConcurrentSessions < 1 || maxQueuedRequests < 1) {
            throw new IllegalArgumentException(String.format(
                "maxConcurrentSessions and maxQueuedRequests must be at least 1 for '%s', got %d and %d",
                name, maxConcurrentSessions, maxQueuedRequests));
        }
        this.sessionSettings = SessionSettings.fromConfig(
            options.hasPath("session") ? options.getConfig("session") : ConfigFactory.empty());
        Path fallbackReplays = Path.of(options.hasPath("results.fallbackReplayDirectory")
            ? options.getString("results.fallbackReplayDirectory")
            : "replays");
        this.aggregator = new ResultAggregator(resultLog, new ReplayWriter(fallbackReplays),
            sessionSettings.stepsPerSecond(), this::recordError);
        this.queue = new LinkedBlockingQueue<>(maxQueuedRequests);
        this.sessionPermits = new Semaphore(maxConcurrentSessions, true);
        AtomicLong threadIds = new AtomicLong();
        this.sessionExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, name + "-session-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    protected void logStarted() {
        log.info("InstanceCoordinator started: maxConcurrentSessions={}, maxQueuedRequests={}, ports={}",
            maxConcurrentSessions, maxQueuedRequests, ports.getResourceName());
    }

    @Override
    protected void run() throws InterruptedException {
        while (!isStopRequested()) {
            if (!sessionPermits.tryAcquire(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS)) {
                continue;
            }
            MatchRequest next = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            if (next == null) {
                sessionPermits.release();
                continue;
            }
            if (next.isAnswered() || !next.getSupervisor().isOpen()) {
                log.debug("Dropping request {}: supervisor is gone", next.getSequence());
                sessionPermits.release();
                continue;
            }
            admit(next);
        }
    }

    /**
     * Queues a match request.
     *
     * @param supervisor The requesting supervisor.
     * @param config     The validated configuration.
     * @return the queued request, or empty if it was rejected.
     */
    public Optional<MatchRequest> submit(IConnection supervisor, MatchConfig config) {
        MatchRequest request = new MatchRequest(requestIds.incrementAndGet(), config, supervisor);
        State state = getCurrentState();
        if (state != State.RUNNING) {
            reject(request, "Coordinator is not running");
            return Optional.empty();
        }
        // announce the position first so that it always precedes the admission notice
        if (sessionPermits.availablePermits() == 0 || !queue.isEmpty()) {
            if (queue.remainingCapacity() == 0) {
                reject(request, "No launch slot available");
                return Optional.empty();
            }
            request.progress(SupervisorMessages.queued(queue.size() + 1));
        }
        if (!queue.offer(request)) {
            reject(request, "No launch slot available");
            return Optional.empty();
        }
        log.debug("Queued request {} for match '{}'", request.getSequence(), config.getMatchId());
        return Optional.of(request);
    }

    /**
     * Attaches a bot to a session awaiting players.
     *
     * @param connection  The bot's connection.
     * @param join        The bot's join request.
     * @param playerHint  Player identifier from the connection handshake, or {@code null}.
     * @return where the bot was attached, or empty if no session awaits players.
     */
    public Optional<BotRoute> routeBot(IConnection connection, RequestFrame join, String playerHint) {
        for (int attempt = 0; attempt < ROUTE_ATTEMPTS; attempt++) {
            Optional<BotRoute> candidate = findSlot(join.playerName(), playerHint);
            if (candidate.isEmpty()) {
                return Optional.empty();
            }
            BotRoute route = candidate.get();
            if (route.session().attach(route.slot(), connection, join)) {
                return candidate;
            }
        }
        log.debug("Could not attach bot connection {} after {} attempts", connection.id(), ROUTE_ATTEMPTS);
        return Optional.empty();
    }

    /**
     * Aborts everything a supervisor has requested: queued requests are dropped and live
     * sessions end with reason Aborted.
     *
     * @param supervisor The supervisor.
     * @param reason     Why, for the log.
     */
    public void abortRequestsOf(IConnection supervisor, String reason) {
        boolean removed = queue.removeIf(r -> r.getSupervisor() == supervisor);
        if (removed) {
            log.debug("Dropped queued requests of supervisor {}", supervisor.id());
        }
        for (MatchSession session : sessionsOf(supervisor)) {
            session.abort(reason);
        }
    }

    /**
     * @param supervisor The supervisor.
     * @return {@code true} if the supervisor has a request that is not yet answered.
     */
    public boolean hasOutstandingRequest(IConnection supervisor) {
        for (MatchRequest request : queue) {
            if (request.getSupervisor() == supervisor && !request.isAnswered()) {
                return true;
            }
        }
        return sessionsOf(supervisor).stream().anyMatch(s -> !s.getRequest().isAnswered());
    }

    /**
     * @return a snapshot of the live sessions, oldest first.
     */
    public List<MatchSession> getSessions() {
        synchronized (registryLock) {
            return new ArrayList<>(sessions.values());
        }
    }

    public PortAllocator getPorts() {
        return ports;
    }

    public IResultLog getResultLog() {
        return resultLog;
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("sessions_started", sessionsStarted.get());
        metrics.put("sessions_completed", sessionsCompleted.get());
        metrics.put("sessions_rejected", sessionsRejected.get());
        synchronized (registryLock) {
            metrics.put("active_sessions", sessions.size());
        }
        metrics.put("queued_requests", queue.size());
    }

    @Override
    protected void onStopped() {
        for (MatchRequest request = queue.poll(); request != null; request = queue.poll()) {
            reject(request, "Node is shutting down");
        }
        for (MatchSession session : getSessions()) {
            session.abort("Node is shutting down");
        }
        sessionExecutor.shutdown();
        try {
            long graceMillis = sessionSettings.terminationGrace().toMillis() + 5_000;
            if (!sessionExecutor.awaitTermination(graceMillis, TimeUnit.MILLISECONDS)) {
                log.warn("Sessions did not finish within {} ms, interrupting", graceMillis);
                sessionExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            sessionExecutor.shutdownNow();
        }
    }

    private void admit(MatchRequest request) {
        MatchSession session = new MatchSession(sessionIds.incrementAndGet(), request, sessionSettings, ports,
            engineFactory, aggregator, sessionExecutor);
        synchronized (registryLock) {
            session.open();
            sessions.put(session.getId(), session);
        }
        request.progress(SupervisorMessages.configReceived());
        sessionsStarted.incrementAndGet();
        try {
            sessionExecutor.execute(() -> runSession(session));
        } catch (RejectedExecutionException e) {
            synchronized (registryLock) {
                sessions.remove(session.getId());
            }
            sessionPermits.release();
            reject(request, "Node is shutting down");
        }
    }

    private void runSession(MatchSession session) {
        try {
            session.run();
        } finally {
            synchronized (registryLock) {
                sessions.remove(session.getId());
            }
            sessionsCompleted.incrementAndGet();
            sessionPermits.release();
        }
    }

    private Optional<BotRoute> findSlot(String playerName, String playerHint) {
        List<MatchSession> awaiting = new ArrayList<>();
        synchronized (registryLock) {
            for (MatchSession session : sessions.values()) {
                if (session.isAwaitingPlayers()) {
                    awaiting.add(session);
                }
            }
        }
        for (String name : new String[] {playerName, playerHint}) {
            for (MatchSession session : awaiting) {
                Optional<PlayerSlot> slot = session.freeSlotFor(name);
                if (slot.isPresent()) {
                    return Optional.of(new BotRoute(session, slot.get()));
                }
            }
        }
        for (MatchSession session : awaiting) {
            Optional<PlayerSlot> slot = session.firstFreeSlot();
            if (slot.isPresent()) {
                return Optional.of(new BotRoute(session, slot.get()));
            }
        }
        return Optional.empty();
    }

    private List<MatchSession> sessionsOf(IConnection supervisor) {
        List<MatchSession> owned = new ArrayList<>();
        synchronized (registryLock) {
            for (MatchSession session : sessions.values()) {
                if (session.getRequest().getSupervisor() == supervisor) {
                    owned.add(session);
                }
            }
        }
        return owned;
    }

    private void reject(MatchRequest request, String reason) {
        if (request.respond(SupervisorMessages.rejected(reason))) {
            sessionsRejected.incrementAndGet();
            log.warn("Rejected request {} for match '{}': {}", request.getSequence(),
                request.getConfig().getMatchId(), reason);
        }
    }

    /**
     * Where a bot was attached.
     *
     * @param session The session.
     * @param slot    The slot within the session.
     */
    public record BotRoute(MatchSession session, PlayerSlot slot) {
    }
}
