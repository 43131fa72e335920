package org.arenaclient.match.testing;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.arenaclient.match.model.PlayerSlot;
import org.arenaclient.match.protocol.FrameCodec;
import org.arenaclient.match.services.InstanceCoordinator;
import org.arenaclient.match.services.InstanceCoordinator.BotRoute;
import org.arenaclient.match.session.MatchSession;

/**
 * A bot that plays in lockstep: every response it receives triggers its next frame.
 * <p>
 * Frames are numbered from 1; frame 1 answers the join response. By default every frame is an
 * observation request carrying its number as id, sent right away.
 */
public class ScriptedBot {

    private final String name;
    private final ScheduledExecutorService scheduler;
    private final FakeConnection connection;
    private final Map<Integer, Duration> delays = new ConcurrentHashMap<>();
    private final Map<Integer, byte[]> frames = new ConcurrentHashMap<>();
    private final AtomicInteger responses = new AtomicInteger();
    private final CompletableFuture<Void> placed = new CompletableFuture<>();
    private volatile Duration pace = Duration.ZERO;
    private volatile int disconnectBefore = -1;
    private volatile int silentFrom = -1;
    private volatile MatchSession session;
    private volatile PlayerSlot slot;

    public ScriptedBot(String name, ScheduledExecutorService scheduler) {
        this.name = name;
        this.scheduler = scheduler;
        this.connection = new FakeConnection("bot-" + name);
        this.connection.onBinary(this::onResponse);
    }

    public ScriptedBot delay(int frame, Duration delay) {
        delays.put(frame, delay);
        return this;
    }

    public ScriptedBot send(int frame, byte[] bytes) {
        frames.put(frame, bytes);
        return this;
    }

    public ScriptedBot pace(Duration pace) {
        this.pace = pace;
        return this;
    }

    /**
     * Closes the connection instead of sending the given frame.
     */
    public ScriptedBot disconnectBefore(int frame) {
        this.disconnectBefore = frame;
        return this;
    }

    /**
     * Stops sending from the given frame on while keeping the connection open.
     */
    public ScriptedBot silentFrom(int frame) {
        this.silentFrom = frame;
        return this;
    }

    /**
     * Attaches the bot to a session slot with its join request.
     *
     * @return whether the session accepted the bot.
     */
    public boolean attach(MatchSession session, PlayerSlot slot) {
        this.session = session;
        this.slot = slot;
        placed.complete(null);
        return session.attach(slot, connection, FrameCodec.decodeRequest(TestFrames.joinRequest(name)));
    }

    /**
     * Lets the coordinator place the bot, the way the gateway does for a join request.
     *
     * @param coordinator The coordinator.
     * @param playerHint  Handshake player hint, or {@code null}.
     * @return where the bot was placed, empty if no session awaits players.
     */
    public Optional<BotRoute> join(InstanceCoordinator coordinator, String playerHint) {
        Optional<BotRoute> route = coordinator.routeBot(connection,
            FrameCodec.decodeRequest(TestFrames.joinRequest(name)), playerHint);
        route.ifPresent(r -> {
            session = r.session();
            slot = r.slot();
            placed.complete(null);
        });
        return route;
    }

    public String name() {
        return name;
    }

    public FakeConnection connection() {
        return connection;
    }

    public int responsesReceived() {
        return responses.get();
    }

    private void onResponse(byte[] response) {
        int next = responses.incrementAndGet();
        if (next == disconnectBefore) {
            placed.thenRun(() -> scheduler.execute(() -> {
                connection.close(1000, "Bot left");
                session.botDisconnected(slot);
            }));
            return;
        }
        if (silentFrom > 0 && next >= silentFrom) {
            return;
        }
        byte[] frame = frames.getOrDefault(next, TestFrames.observationRequest(next));
        Duration delay = delays.getOrDefault(next, pace);
        placed.thenRun(() -> scheduler.schedule(() -> session.deliver(slot, frame), delay.toMillis(), TimeUnit.MILLISECONDS));
    }
}
