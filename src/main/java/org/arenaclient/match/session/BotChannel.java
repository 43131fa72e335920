package org.arenaclient.match.session;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

import org.arenaclient.match.api.connection.BotDisconnectedException;
import org.arenaclient.match.api.connection.IConnection;
import org.arenaclient.match.model.PlayerSlot;
import org.arenaclient.match.protocol.RequestFrame;
import org.arenaclient.match.utils.FrameMailbox;

/**
 * A bot attached to a session slot.
 * <p>
 * Buffers the bot's inbound frames and keeps the timing the scheduler needs: the bot owes a
 * frame from the moment a response is sent to it until its next frame arrives. Response latency
 * is averaged over all such windows.
 */
public final class BotChannel {

    private static final long NOT_OWED = -1;

    private final PlayerSlot slot;
    private final String playerName;
    private final IConnection connection;
    private final RequestFrame joinRequest;
    private final FrameMailbox inbound = new FrameMailbox();
    private final AtomicLong owedSinceNanos = new AtomicLong(NOT_OWED);
    private final AtomicLong latencyNanosTotal = new AtomicLong();
    private final AtomicLong latencySamples = new AtomicLong();
    private volatile int enginePlayerId;
    private volatile boolean disconnected;

    /**
     * @param slot        The slot the bot occupies.
     * @param playerName  The configured player identifier of that slot.
     * @param connection  The bot's connection.
     * @param joinRequest The bot's join request, forwarded to the engine at launch.
     */
    public BotChannel(PlayerSlot slot, String playerName, IConnection connection, RequestFrame joinRequest) {
        this.slot = slot;
        this.playerName = playerName;
        this.connection = connection;
        this.joinRequest = joinRequest;
        this.enginePlayerId = slot.number();
    }

    /**
     * Accepts a frame from the bot's connection.
     *
     * @param frame The frame.
     */
    public void deliver(byte[] frame) {
        long since = owedSinceNanos.getAndSet(NOT_OWED);
        if (since != NOT_OWED) {
            latencyNanosTotal.addAndGet(System.nanoTime() - since);
            latencySamples.incrementAndGet();
        }
        inbound.deliver(frame);
    }

    /**
     * @return a future for the bot's next frame; fails with {@link BotDisconnectedException}
     *         once the bot is gone and its buffered frames are consumed.
     */
    public CompletableFuture<byte[]> nextFrame() {
        return inbound.next();
    }

    /**
     * Sends a frame to the bot and starts its owed window.
     *
     * @param frame The frame.
     */
    public void send(byte[] frame) {
        owedSinceNanos.set(System.nanoTime());
        connection.sendBinary(frame);
    }

    /**
     * Marks the bot as gone and fails its pending frame request.
     */
    public void markDisconnected() {
        disconnected = true;
        inbound.close(new BotDisconnectedException("Bot '" + playerName + "' in slot " + slot.number() + " disconnected"));
    }

    /**
     * @param nowNanos The current {@link System#nanoTime()}.
     * @return how long the bot has owed a frame, zero if it owes none.
     */
    public Duration owedFor(long nowNanos) {
        long since = owedSinceNanos.get();
        return since == NOT_OWED ? Duration.ZERO : Duration.ofNanos(nowNanos - since);
    }

    /**
     * Restarts the owed window if the bot still owes a frame, so that one missed budget is
     * counted once.
     *
     * @param nowNanos The current {@link System#nanoTime()}.
     */
    public void restartOwedWindow(long nowNanos) {
        long since = owedSinceNanos.get();
        if (since != NOT_OWED) {
            owedSinceNanos.compareAndSet(since, nowNanos);
        }
    }

    /**
     * @return the mean time between a response and the bot's next frame, in milliseconds.
     */
    public double averageFrameTimeMillis() {
        long samples = latencySamples.get();
        return samples == 0 ? 0.0 : latencyNanosTotal.get() / (double) samples / 1_000_000.0;
    }

    /**
     * Closes the bot's connection.
     *
     * @param statusCode WebSocket close status.
     * @param reason     Close reason.
     */
    public void close(int statusCode, String reason) {
        connection.close(statusCode, reason);
    }

    public PlayerSlot slot() {
        return slot;
    }

    public String playerName() {
        return playerName;
    }

    public IConnection connection() {
        return connection;
    }

    public RequestFrame joinRequest() {
        return joinRequest;
    }

    public int enginePlayerId() {
        return enginePlayerId;
    }

    void setEnginePlayerId(int enginePlayerId) {
        this.enginePlayerId = enginePlayerId;
    }

    public boolean isDisconnected() {
        return disconnected;
    }
}
