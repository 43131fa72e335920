package org.arenaclient.match.session;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

import org.arenaclient.match.api.connection.IConnection;
import org.arenaclient.match.api.engine.EngineLaunchException;
import org.arenaclient.match.api.engine.EngineLinkException;
import org.arenaclient.match.api.engine.IEngine;
import org.arenaclient.match.api.engine.IEngineFactory;
import org.arenaclient.match.api.resources.PortUnavailableException;
import org.arenaclient.match.model.EndReason;
import org.arenaclient.match.model.GamePorts;
import org.arenaclient.match.model.MatchConfig;
import org.arenaclient.match.model.MatchResult;
import org.arenaclient.match.model.PlayerSlot;
import org.arenaclient.match.model.SessionState;
import org.arenaclient.match.protocol.RequestFrame;
import org.arenaclient.match.protocol.SupervisorMessages;
import org.arenaclient.match.resources.PortAllocator;
import org.arenaclient.match.services.ResultAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One match from admission to its single terminal response.
 * <p>
 * {@link #run()} executes the whole lifecycle on the calling thread: wait for both bots, lease the
 * engine port and the game ports, start the engine, create the game over player 1's link, forward
 * the bots' join requests with the game ports, play, then save the replay, terminate the engine,
 * release the ports and hand the result to the {@link ResultAggregator}.
 * Cleanup runs on every exit path.
 * <p>
 * Gateway threads interact with a running session only through {@link #attach}, {@link #deliver},
 * {@link #botDisconnected} and {@link #abort}.
 */
public class MatchSession implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(MatchSession.class);

    static final int CLOSE_NORMAL = 1000;

    private final long id;
    private final MatchRequest request;
    private final MatchConfig config;
    private final SessionSettings settings;
    private final PortAllocator ports;
    private final IEngineFactory engineFactory;
    private final ResultAggregator aggregator;
    private final Executor executor;

    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.IDLE);
    private final Object slotLock = new Object();
    private final BotChannel[] bots = new BotChannel[PlayerSlot.values().length];
    private final CompletableFuture<Void> playersReady = new CompletableFuture<>();
    private final CompletableFuture<EndCondition> abortSignal = new CompletableFuture<>();
    private final StrikeLedger strikes;
    private final long createdNanos = System.nanoTime();

    private volatile long launchStartedNanos;
    private volatile int port = -1;
    private volatile GamePorts gamePorts;
    private volatile Path workDirectory;
    private volatile IEngine engine;
    private volatile ProtocolBridge bridge;
    private volatile StepScheduler scheduler;
    private volatile MatchResult result;

    /**
     * @param id            Session number, unique within the node.
     * @param request       The admitted request.
     * @param settings      Node-wide session settings.
     * @param ports         Port pool shared by all sessions.
     * @param engineFactory Factory for the session's engine.
     * @param aggregator    Receives the result.
     * @param executor      Executor for relay continuations.
     */
    public MatchSession(long id, MatchRequest request, SessionSettings settings, PortAllocator ports,
                        IEngineFactory engineFactory, ResultAggregator aggregator, Executor executor) {
        this.id = id;
        this.request = request;
        this.config = request.getConfig();
        this.settings = settings;
        this.ports = ports;
        this.engineFactory = engineFactory;
        this.aggregator = aggregator;
        this.executor = executor;
        this.strikes = new StrikeLedger(config.getStrikes());
    }

    /**
     * Opens the session for bot connections.
     */
    public void open() {
        transition(SessionState.AWAITING_PLAYERS);
        log.info("Session {} awaiting players '{}' and '{}' for map '{}'",
            id, config.getPlayer1(), config.getPlayer2(), config.getMapName());
    }

    @Override
    public void run() {
        EndCondition end = null;
        try {
            end = awaitPlayers();
            if (end == null) {
                end = launch();
            }
            if (end == null && !request.isAnswered()) {
                end = play();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            end = EndCondition.error(EndReason.ABORTED, null, "Session thread interrupted");
        } catch (RuntimeException e) {
            log.error("Session {} failed in state {}: {}", id, state.get(), e.getMessage());
            log.debug("Session failure details:", e);
            EndReason reason = state.get() == SessionState.IN_PROGRESS
                ? EndReason.ENGINE_UNRESPONSIVE
                : EndReason.ENGINE_LAUNCH_FAILED;
            end = EndCondition.error(reason, null, e.getMessage());
        } finally {
            finish(end);
        }
    }

    /**
     * Attaches a bot to a free slot.
     *
     * @param slot       The slot.
     * @param connection The bot's connection.
     * @param join       The bot's buffered join request.
     * @return {@code true} if the bot was attached; {@code false} if the slot is taken or the
     *         session no longer accepts players.
     */
    public boolean attach(PlayerSlot slot, IConnection connection, RequestFrame join) {
        boolean complete;
        synchronized (slotLock) {
            if (state.get() != SessionState.AWAITING_PLAYERS || playersReady.isDone() || bots[slot.index()] != null) {
                return false;
            }
            bots[slot.index()] = new BotChannel(slot, config.getPlayer(slot), connection, join);
            complete = bots[0] != null && bots[1] != null;
        }
        log.info("Session {}: bot '{}' attached to slot {}", id, config.getPlayer(slot), slot.number());
        request.progress(SupervisorMessages.botConnected(slot));
        if (complete) {
            playersReady.complete(null);
        }
        return true;
    }

    /**
     * @param playerName A player identifier from a join request or handshake.
     * @return the free slot configured for that player, if any.
     */
    public Optional<PlayerSlot> freeSlotFor(String playerName) {
        if (playerName == null) {
            return Optional.empty();
        }
        synchronized (slotLock) {
            for (PlayerSlot slot : PlayerSlot.values()) {
                if (bots[slot.index()] == null && playerName.equals(config.getPlayer(slot))) {
                    return Optional.of(slot);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * @return the lowest free slot, if any.
     */
    public Optional<PlayerSlot> firstFreeSlot() {
        synchronized (slotLock) {
            for (PlayerSlot slot : PlayerSlot.values()) {
                if (bots[slot.index()] == null) {
                    return Optional.of(slot);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Passes a binary frame from an attached bot to its channel.
     *
     * @param slot  The bot's slot.
     * @param frame The frame.
     */
    public void deliver(PlayerSlot slot, byte[] frame) {
        BotChannel bot = bot(slot);
        if (bot != null) {
            bot.deliver(frame);
        }
    }

    /**
     * Reports that an attached bot's connection closed. While the session still waits for
     * players the slot is freed for a reconnect; afterwards the bot counts as disconnected.
     *
     * @param slot The bot's slot.
     */
    public void botDisconnected(PlayerSlot slot) {
        BotChannel bot;
        synchronized (slotLock) {
            bot = bots[slot.index()];
            if (bot == null) {
                return;
            }
            if (state.get() == SessionState.AWAITING_PLAYERS && !playersReady.isDone()) {
                bots[slot.index()] = null;
                log.info("Session {}: bot '{}' left slot {} before the match started", id, bot.playerName(), slot.number());
                return;
            }
        }
        log.info("Session {}: bot '{}' disconnected", id, bot.playerName());
        bot.markDisconnected();
    }

    /**
     * Ends the session as soon as possible with outcome Error, reason Aborted.
     *
     * @param reason Why the session is aborted, for the log.
     */
    public void abort(String reason) {
        if (abortSignal.complete(EndCondition.error(EndReason.ABORTED, null, reason))) {
            log.info("Session {} aborted: {}", id, reason);
        }
    }

    private EndCondition awaitPlayers() throws InterruptedException {
        Duration timeout = settings.playerConnectTimeout();
        try {
            CompletableFuture.anyOf(playersReady, abortSignal).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            PlayerSlot missing = null;
            synchronized (slotLock) {
                if (bots[0] == null ^ bots[1] == null) {
                    missing = bots[0] == null ? PlayerSlot.PLAYER_1 : PlayerSlot.PLAYER_2;
                }
            }
            log.warn("Session {}: players did not connect within {}", id, timeout);
            return EndCondition.error(EndReason.PLAYER_CONNECT_TIMEOUT, missing,
                "Players did not connect within " + timeout.toSeconds() + "s");
        } catch (ExecutionException e) {
            throw new IllegalStateException("Player wait failed", e.getCause());
        }
        if (abortSignal.isDone()) {
            return abortSignal.join();
        }
        synchronized (slotLock) {
            transition(SessionState.LAUNCHING);
        }
        launchStartedNanos = System.nanoTime();
        return null;
    }

    private EndCondition launch() throws InterruptedException {
        try {
            port = ports.allocate();
            gamePorts = ports.allocateGamePorts();
        } catch (PortUnavailableException e) {
            log.warn("Session {} rejected: {}", id, e.getMessage());
            request.respond(SupervisorMessages.rejected("No free port: " + e.getMessage()));
            return null;
        }

        try {
            workDirectory = Files.createDirectories(settings.workDirectory().resolve("session-" + id));
            engine = engineFactory.create(config, port, workDirectory);
            engine.onExit(this::onEngineExit);
            bridge = new ProtocolBridge(engine, config.isDisableDebug(), settings.engineResponseTimeout(), executor);
            engine.start();
            createGame();
            if (!abortSignal.isDone()) {
                joinBots();
            }
        } catch (IOException | EngineLaunchException | EngineLinkException e) {
            log.warn("Session {}: engine launch failed: {}", id, e.getMessage());
            return EndCondition.error(EndReason.ENGINE_LAUNCH_FAILED, null, e.getMessage());
        }

        if (abortSignal.isDone()) {
            return abortSignal.join();
        }
        transition(SessionState.IN_PROGRESS);
        if (!engine.isAlive()) {
            onEngineExit();
        }
        log.info("Session {} in progress: '{}' vs '{}' on '{}' (port {}, {} mode)", id, config.getPlayer1(),
            config.getPlayer2(), config.getMapName(), port, config.isRealTime() ? "real-time" : "stepped");
        return null;
    }

    private void createGame() throws InterruptedException {
        awaitHandshake(bridge.createGame(PlayerSlot.PLAYER_1, config.getMapFile(), config.isRealTime()),
            "Game creation");
    }

    private void joinBots() throws InterruptedException {
        List<CompletableFuture<Void>> joins = new ArrayList<>();
        for (BotChannel bot : bots) {
            joins.add(bridge.join(bot, gamePorts).thenAccept(bot::setEnginePlayerId));
        }
        awaitHandshake(CompletableFuture.allOf(joins.toArray(new CompletableFuture[0])), "Join handshake");
    }

    private void awaitHandshake(CompletableFuture<?> handshake, String step) throws InterruptedException {
        Duration timeout = settings.joinTimeout();
        try {
            CompletableFuture.anyOf(handshake, abortSignal).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new EngineLaunchException(step + " did not complete within " + timeout.toSeconds() + "s");
        } catch (ExecutionException e) {
            Throwable cause = ProtocolBridge.unwrap(e.getCause());
            throw new EngineLaunchException(step + " failed: " + cause.getMessage(), cause);
        }
    }

    private EndCondition play() throws InterruptedException {
        Map<PlayerSlot, BotChannel> players = new EnumMap<>(PlayerSlot.class);
        for (BotChannel bot : bots) {
            players.put(bot.slot(), bot);
        }
        scheduler = new StepScheduler(players, bridge, engine, strikes, abortSignal, executor,
            config.getMaxFrameTime(), config.getMaxGameTime(), settings.maxDecodeErrors(),
            settings.realTimeStepInterval());
        return config.isRealTime() ? scheduler.playRealTime() : scheduler.playStepped();
    }

    private void onEngineExit() {
        if (state.get() == SessionState.IN_PROGRESS
            && abortSignal.complete(EndCondition.crash(EndReason.ENGINE_CRASH, "Engine process exited unexpectedly"))) {
            log.warn("Session {}: engine exited unexpectedly", id);
        }
    }

    private void finish(EndCondition end) {
        try {
            boolean played = state.get() == SessionState.IN_PROGRESS;
            if (played) {
                transition(SessionState.ENDING);
            }

            byte[] replay = null;
            if (played && end != null && config.isReplayRequested() && engine != null && engine.isAlive()) {
                replay = saveReplay();
            }
            terminateEngine();
            if (port > 0) {
                ports.release(port);
            }
            if (gamePorts != null) {
                ports.release(gamePorts);
            }

            if (end != null) {
                MatchResult built = buildResult(end);
                log.info("Session {} ended: {} ({}) after {} steps{}", id, end.outcome().wireName(),
                    end.reason().wireName(), built.steps(), end.detail() != null ? ": " + end.detail() : "");
                result = aggregator.complete(request, built, replay);
            } else if (request.respond(SupervisorMessages.rejected("Session ended without a result"))) {
                log.warn("Session {} ended without a result", id);
            }
            transition(played && end != null ? SessionState.CLOSED : SessionState.FAILED);
        } catch (RuntimeException e) {
            log.error("Session {} cleanup failed: {}", id, e.getMessage());
            log.debug("Cleanup failure details:", e);
            request.respond(SupervisorMessages.error("Session cleanup failed: " + e.getMessage()));
            state.set(SessionState.FAILED);
        } finally {
            closeBots();
            deleteWorkDirectory();
        }
    }

    private byte[] saveReplay() {
        try {
            return bridge.saveReplay(PlayerSlot.PLAYER_1)
                .get(settings.engineResponseTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Session {}: interrupted while saving the replay", id);
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Session {}: failed to save the replay: {}", id, e.getMessage());
        }
        return null;
    }

    private void terminateEngine() {
        IEngine current = engine;
        if (current == null) {
            return;
        }
        try {
            current.terminate(settings.terminationGrace());
        } catch (RuntimeException e) {
            log.warn("Session {}: engine termination failed: {}", id, e.getMessage());
        }
    }

    private MatchResult buildResult(EndCondition end) {
        Map<PlayerSlot, String> players = new EnumMap<>(PlayerSlot.class);
        Map<PlayerSlot, Integer> strikeCounts = new EnumMap<>(PlayerSlot.class);
        Map<PlayerSlot, Double> frameTimes = new EnumMap<>(PlayerSlot.class);
        for (PlayerSlot slot : PlayerSlot.values()) {
            players.put(slot, config.getPlayer(slot));
            strikeCounts.put(slot, strikes.count(slot));
            BotChannel bot = bot(slot);
            frameTimes.put(slot, bot != null ? bot.averageFrameTimeMillis() : 0.0);
        }
        long start = launchStartedNanos > 0 ? launchStartedNanos : createdNanos;
        StepScheduler played = scheduler;
        return new MatchResult(
            config.getMatchId(),
            config.getMapName(),
            players,
            end.outcome(),
            end.reason(),
            end.loser(),
            MatchResult.derivePlayerResults(end.outcome(), end.reason(), end.loser()),
            played != null ? played.steps() : 0,
            played != null ? played.lastGameLoop() : 0,
            Duration.ofNanos(System.nanoTime() - start),
            Instant.now(),
            strikeCounts,
            frameTimes,
            "");
    }

    private void closeBots() {
        for (PlayerSlot slot : PlayerSlot.values()) {
            BotChannel bot = bot(slot);
            if (bot != null) {
                bot.markDisconnected();
                bot.close(CLOSE_NORMAL, "Match ended");
            }
        }
    }

    private void deleteWorkDirectory() {
        Path directory = workDirectory;
        if (directory == null || !Files.exists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            log.warn("Session {}: failed to delete work directory {}: {}", id, directory, e.getMessage());
        }
    }

    private BotChannel bot(PlayerSlot slot) {
        synchronized (slotLock) {
            return bots[slot.index()];
        }
    }

    private void transition(SessionState next) {
        SessionState current = state.get();
        if (!current.canTransitionTo(next) || !state.compareAndSet(current, next)) {
            throw new IllegalStateException("Session " + id + " cannot move from " + current + " to " + next);
        }
        log.debug("Session {}: {} -> {}", id, current, next);
    }

    public long getId() {
        return id;
    }

    public SessionState getState() {
        return state.get();
    }

    public MatchRequest getRequest() {
        return request;
    }

    public MatchConfig getConfig() {
        return config;
    }

    public int getPort() {
        return port;
    }

    /**
     * @return the game ports passed to the bots' join requests, or {@code null} before launch.
     */
    public GamePorts getGamePorts() {
        return gamePorts;
    }

    /**
     * @return {@code true} while the session accepts bot connections.
     */
    public boolean isAwaitingPlayers() {
        return state.get() == SessionState.AWAITING_PLAYERS && !playersReady.isDone();
    }

    /**
     * @return the delivered result, once the session has finished with one.
     */
    public Optional<MatchResult> getResult() {
        return Optional.ofNullable(result);
    }

    /**
     * @return the strike ledger, for inspection.
     */
    public StrikeLedger getStrikes() {
        return strikes;
    }
}
