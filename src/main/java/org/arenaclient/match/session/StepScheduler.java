package org.arenaclient.match.session;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.arenaclient.match.api.connection.BotDisconnectedException;
import org.arenaclient.match.api.engine.IEngine;
import org.arenaclient.match.model.EndReason;
import org.arenaclient.match.model.PlayerSlot;
import org.arenaclient.match.protocol.GameResult;
import org.arenaclient.match.protocol.ResponseFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a running match until an end condition holds.
 * <p>
 * In stepped mode each step asks both bots for one frame concurrently, each bounded by the
 * per-frame budget, relays what arrived and then evaluates the step. A bot that misses its budget
 * is struck for the step. Its frame stays requested and is relayed the moment it arrives; the
 * exchange is counted in the step in which it completes. While a bot is late the other bot's
 * relay may still wait on an engine that answers both players together, so that relay is
 * carried over to the next step instead of holding the current one open.
 * <p>
 * In real-time mode frames are relayed as soon as they arrive and the match advances on a fixed
 * tick. At every tick a bot that has owed a frame for at least the budget is struck once, and its
 * owed window restarts.
 * <p>
 * Both modes evaluate a step in the same order. Strikes are recorded first, then the step ends on
 * disconnect, engine failure, engine game-over, surrender, protocol errors, strike limit or step
 * limit. The abort signal is awaited alongside every
 * step so that an engine exit or an external abort ends play without waiting for the bots.
 */
final class StepScheduler {

    private static final Logger log = LoggerFactory.getLogger(StepScheduler.class);

    private final Map<PlayerSlot, BotChannel> bots;
    private final ProtocolBridge bridge;
    private final IEngine engine;
    private final StrikeLedger strikes;
    private final CompletableFuture<EndCondition> abortSignal;
    private final Executor executor;
    private final Duration maxFrameTime;
    private final long maxSteps;
    private final int maxDecodeErrors;
    private final Duration tickInterval;
    private final Map<PlayerSlot, Integer> decodeErrors = new EnumMap<>(PlayerSlot.class);

    private volatile long steps;
    private volatile long lastGameLoop;

    /**
     * @param bots            Attached bots, one per slot, already joined.
     * @param bridge          The protocol bridge.
     * @param engine          The running engine.
     * @param strikes         Strike ledger of the session.
     * @param abortSignal     Completed by the session when play must stop at once.
     * @param executor        Executor for relay continuations.
     * @param maxFrameTime    Per-frame budget of a bot.
     * @param maxSteps        Step limit, 0 for none.
     * @param maxDecodeErrors Malformed frames tolerated per bot.
     * @param tickInterval    Tick length in real-time mode.
     */
    StepScheduler(Map<PlayerSlot, BotChannel> bots, ProtocolBridge bridge, IEngine engine, StrikeLedger strikes,
                  CompletableFuture<EndCondition> abortSignal, Executor executor, Duration maxFrameTime,
                  long maxSteps, int maxDecodeErrors, Duration tickInterval) {
        this.bots = bots;
        this.bridge = bridge;
        this.engine = engine;
        this.strikes = strikes;
        this.abortSignal = abortSignal;
        this.executor = executor;
        this.maxFrameTime = maxFrameTime;
        this.maxSteps = maxSteps;
        this.maxDecodeErrors = maxDecodeErrors;
        this.tickInterval = tickInterval;
        for (PlayerSlot slot : PlayerSlot.values()) {
            decodeErrors.put(slot, 0);
        }
    }

    /**
     * Plays in stepped mode.
     *
     * @return the end condition.
     * @throws InterruptedException if the session thread is interrupted.
     */
    EndCondition playStepped() throws InterruptedException {
        Map<PlayerSlot, InFlight> inFlight = new EnumMap<>(PlayerSlot.class);
        try {
            while (true) {
                if (abortSignal.isDone()) {
                    return abortSignal.join();
                }

                for (BotChannel bot : bots.values()) {
                    inFlight.computeIfAbsent(bot.slot(), slot -> new InFlight(bot));
                }
                CompletableFuture<Void> all = CompletableFuture.allOf(inFlight.values().stream()
                    .map(InFlight::exchange)
                    .toArray(CompletableFuture[]::new));

                awaitBudget(all);
                if (abortSignal.isDone()) {
                    return abortSignal.join();
                }

                Set<PlayerSlot> late = EnumSet.noneOf(PlayerSlot.class);
                for (InFlight pending : inFlight.values()) {
                    if (!pending.frame().isDone()) {
                        late.add(pending.slot());
                    }
                }
                if (late.isEmpty()) {
                    // every frame is in; the remaining relays are bounded by the engine response timeout
                    awaitStep(all);
                    if (abortSignal.isDone()) {
                        return abortSignal.join();
                    }
                }

                // a relay still waiting on the engine while the other bot is late carries over
                List<Exchange> completed = new ArrayList<>();
                inFlight.values().removeIf(pending -> {
                    if (!pending.exchange().isDone()) {
                        return false;
                    }
                    completed.add(pending.exchange().join());
                    return true;
                });

                Optional<EndCondition> end = evaluate(completed, late);
                if (end.isPresent()) {
                    return end.get();
                }
            }
        } finally {
            inFlight.values().forEach(pending -> pending.frame().cancel(false));
        }
    }

    /**
     * Plays in real-time mode.
     *
     * @return the end condition.
     * @throws InterruptedException if the session thread is interrupted.
     */
    EndCondition playRealTime() throws InterruptedException {
        ConcurrentLinkedQueue<Exchange> arrived = new ConcurrentLinkedQueue<>();
        List<RelayPump> pumps = new ArrayList<>();
        for (BotChannel bot : bots.values()) {
            RelayPump pump = new RelayPump(bot, arrived);
            pumps.add(pump);
            pump.pull();
        }

        try {
            long interval = tickInterval.toNanos();
            long nextTick = System.nanoTime() + interval;
            while (true) {
                if (abortedWithin(nextTick - System.nanoTime())) {
                    return abortSignal.join();
                }
                nextTick += interval;

                List<Exchange> completed = new ArrayList<>();
                for (Exchange exchange = arrived.poll(); exchange != null; exchange = arrived.poll()) {
                    completed.add(exchange);
                }

                long now = System.nanoTime();
                Set<PlayerSlot> late = EnumSet.noneOf(PlayerSlot.class);
                for (BotChannel bot : bots.values()) {
                    if (!bot.isDisconnected() && bot.owedFor(now).compareTo(maxFrameTime) >= 0) {
                        late.add(bot.slot());
                        bot.restartOwedWindow(now);
                    }
                }

                Optional<EndCondition> end = evaluate(completed, late);
                if (end.isPresent()) {
                    return end.get();
                }
            }
        } finally {
            pumps.forEach(RelayPump::stop);
        }
    }

    /**
     * Evaluates one step. Strikes for late bots are recorded against the step before anything can
     * end it. The step counter is incremented unless the step ends on a disconnect or an engine
     * failure.
     *
     * @param exchanges Exchanges completed in this step.
     * @param late      Bots that missed their budget in this step.
     * @return the end condition, if the match is over.
     */
    Optional<EndCondition> evaluate(List<Exchange> exchanges, Set<PlayerSlot> late) {
        for (PlayerSlot slot : late) {
            int count = strikes.record(slot, steps + 1);
            log.warn("Strike {}/{} for bot '{}' at step {}", count, strikes.threshold(), bots.get(slot).playerName(),
                steps + 1);
        }

        Set<PlayerSlot> disconnected = slotsOf(exchanges, Exchange.Type.DISCONNECTED);
        if (disconnected.size() == PlayerSlot.values().length) {
            return Optional.of(EndCondition.tie(EndReason.DISCONNECT, "Both bots disconnected"));
        }
        if (!disconnected.isEmpty()) {
            PlayerSlot loser = disconnected.iterator().next();
            return Optional.of(EndCondition.forfeit(loser, EndReason.DISCONNECT,
                "Bot '" + bots.get(loser).playerName() + "' disconnected"));
        }

        for (Exchange exchange : exchanges) {
            if (exchange.type() == Exchange.Type.ENGINE_FAILURE) {
                return Optional.of(engine.isAlive()
                    ? EndCondition.error(EndReason.ENGINE_UNRESPONSIVE, null, exchange.detail())
                    : EndCondition.crash(EndReason.ENGINE_CRASH, exchange.detail()));
            }
        }

        steps++;

        Map<Integer, GameResult> engineResults = new HashMap<>();
        for (Exchange exchange : exchanges) {
            ResponseFrame response = exchange.response();
            if (response == null) {
                continue;
            }
            if (response.gameLoop() > lastGameLoop) {
                lastGameLoop = response.gameLoop();
            }
            engineResults.putAll(response.playerResults());
        }
        if (!engineResults.isEmpty()) {
            return Optional.of(gameOver(engineResults));
        }

        Set<PlayerSlot> surrendered = slotsOf(exchanges, Exchange.Type.SURRENDERED);
        if (surrendered.size() == PlayerSlot.values().length) {
            return Optional.of(EndCondition.tie(EndReason.SURRENDER, "Both bots left the game"));
        }
        if (!surrendered.isEmpty()) {
            PlayerSlot loser = surrendered.iterator().next();
            log.info("Bot '{}' left the game at step {}", bots.get(loser).playerName(), steps);
            return Optional.of(EndCondition.forfeit(loser, EndReason.SURRENDER, "Left the game"));
        }

        Set<PlayerSlot> protocolViolators = EnumSet.noneOf(PlayerSlot.class);
        for (Exchange exchange : exchanges) {
            if (exchange.type() == Exchange.Type.DECODE_ERROR) {
                int count = decodeErrors.merge(exchange.slot(), 1, Integer::sum);
                log.warn("Malformed frame {} from bot '{}': {}", count, bots.get(exchange.slot()).playerName(),
                    exchange.detail());
                if (count > maxDecodeErrors) {
                    protocolViolators.add(exchange.slot());
                }
            }
        }
        if (protocolViolators.size() == PlayerSlot.values().length) {
            return Optional.of(EndCondition.tie(EndReason.PROTOCOL_ERROR, "Both bots exceeded the malformed frame limit"));
        }
        if (!protocolViolators.isEmpty()) {
            PlayerSlot loser = protocolViolators.iterator().next();
            return Optional.of(EndCondition.forfeit(loser, EndReason.PROTOCOL_ERROR,
                "More than " + maxDecodeErrors + " malformed frames"));
        }

        Set<PlayerSlot> overLimit = EnumSet.noneOf(PlayerSlot.class);
        for (PlayerSlot slot : late) {
            if (strikes.hasReachedThreshold(slot)) {
                overLimit.add(slot);
            }
        }
        if (overLimit.size() == PlayerSlot.values().length) {
            return Optional.of(EndCondition.tie(EndReason.DOUBLE_TIMEOUT, "Both bots reached the strike limit"));
        }
        if (!overLimit.isEmpty()) {
            PlayerSlot loser = overLimit.iterator().next();
            return Optional.of(EndCondition.forfeit(loser, EndReason.TIMEOUT_LIMIT_EXCEEDED,
                "Reached " + strikes.threshold() + " strikes"));
        }

        if (maxSteps > 0 && (steps >= maxSteps || lastGameLoop >= maxSteps)) {
            return Optional.of(EndCondition.tie(EndReason.MAX_STEPS_REACHED, "Step limit " + maxSteps + " reached"));
        }
        return Optional.empty();
    }

    long steps() {
        return steps;
    }

    long lastGameLoop() {
        return lastGameLoop;
    }

    private EndCondition gameOver(Map<Integer, GameResult> engineResults) {
        GameResult first = resultOf(PlayerSlot.PLAYER_1, engineResults);
        GameResult second = resultOf(PlayerSlot.PLAYER_2, engineResults);
        log.info("Engine reported game over at step {}: {} / {}", steps, first, second);
        if (first == GameResult.VICTORY || second == GameResult.DEFEAT) {
            return EndCondition.win(PlayerSlot.PLAYER_1, EndReason.NORMAL);
        }
        if (second == GameResult.VICTORY || first == GameResult.DEFEAT) {
            return EndCondition.win(PlayerSlot.PLAYER_2, EndReason.NORMAL);
        }
        return EndCondition.tie(EndReason.NORMAL, null);
    }

    private GameResult resultOf(PlayerSlot slot, Map<Integer, GameResult> engineResults) {
        GameResult result = engineResults.get(bots.get(slot).enginePlayerId());
        return result != null ? result : engineResults.getOrDefault(slot.number(), GameResult.UNDECIDED);
    }

    private void awaitBudget(CompletableFuture<Void> step) throws InterruptedException {
        try {
            CompletableFuture.anyOf(step, abortSignal).get(maxFrameTime.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            log.trace("Frame budget of {} ms elapsed", maxFrameTime.toMillis());
        } catch (ExecutionException e) {
            throw new IllegalStateException("Step failed unexpectedly", e.getCause());
        }
    }

    private void awaitStep(CompletableFuture<Void> step) throws InterruptedException {
        try {
            CompletableFuture.anyOf(step, abortSignal).get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Step failed unexpectedly", e.getCause());
        }
    }

    private boolean abortedWithin(long nanos) throws InterruptedException {
        try {
            abortSignal.get(Math.max(0, nanos), TimeUnit.NANOSECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Abort signal failed", e.getCause());
        }
    }

    private static Exchange botFailure(PlayerSlot slot, Throwable t) {
        Throwable cause = ProtocolBridge.unwrap(t);
        if (cause instanceof TimeoutException || cause instanceof CancellationException) {
            return Exchange.timedOut(slot);
        }
        if (!(cause instanceof BotDisconnectedException)) {
            log.debug("Unexpected failure on slot {}", slot.number(), cause);
        }
        return Exchange.disconnected(slot);
    }

    private static Set<PlayerSlot> slotsOf(List<Exchange> exchanges, Exchange.Type type) {
        Set<PlayerSlot> slots = EnumSet.noneOf(PlayerSlot.class);
        for (Exchange exchange : exchanges) {
            if (exchange.type() == type) {
                slots.add(exchange.slot());
            }
        }
        return slots;
    }

    /**
     * One bot's frame of the current step and its relay. The relay starts when the frame arrives,
     * whether or not the step that asked for it is still open.
     */
    private final class InFlight {
        private final PlayerSlot slot;
        private final CompletableFuture<byte[]> frame;
        private final CompletableFuture<Exchange> exchange;

        InFlight(BotChannel bot) {
            this.slot = bot.slot();
            this.frame = bot.nextFrame();
            this.exchange = frame.thenCompose(bytes -> bridge.relay(bot, bytes))
                .exceptionally(t -> botFailure(slot, t));
        }

        PlayerSlot slot() {
            return slot;
        }

        CompletableFuture<byte[]> frame() {
            return frame;
        }

        CompletableFuture<Exchange> exchange() {
            return exchange;
        }
    }

    /**
     * Relays one bot's frames continuously in real-time mode.
     */
    private final class RelayPump {
        private final BotChannel bot;
        private final ConcurrentLinkedQueue<Exchange> sink;
        private volatile boolean stopped;
        private volatile CompletableFuture<byte[]> pending;

        RelayPump(BotChannel bot, ConcurrentLinkedQueue<Exchange> sink) {
            this.bot = bot;
            this.sink = sink;
        }

        void pull() {
            if (stopped) {
                return;
            }
            CompletableFuture<byte[]> frame = bot.nextFrame();
            pending = frame;
            frame.thenCompose(bytes -> bridge.relay(bot, bytes))
                .exceptionally(t -> botFailure(bot.slot(), t))
                .thenAcceptAsync(exchange -> {
                    if (stopped) {
                        return;
                    }
                    sink.add(exchange);
                    if (!exchange.isTerminal()) {
                        pull();
                    }
                }, executor);
        }

        void stop() {
            stopped = true;
            CompletableFuture<byte[]> frame = pending;
            if (frame != null) {
                frame.cancel(false);
            }
        }
    }
}
