package org.arenaclient.match.api.engine;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import org.arenaclient.match.model.PlayerSlot;

/**
 * Capability handle on one game-engine instance.
 * <p>
 * The engine exposes one control link per player slot. Frames sent on a slot's link are answered
 * on the same link, in order. Session logic depends only on this interface.
 */
public interface IEngine {

    /**
     * Launches the engine and connects the control links of both slots.
     *
     * @throws EngineLaunchException if the process cannot be started, exits during startup or
     *                               its endpoint is not reachable within the startup window.
     */
    void start();

    boolean isAlive();

    /**
     * Sends a frame on a slot's control link.
     *
     * @param slot  The player slot.
     * @param frame The frame, sent verbatim.
     * @return a future completed once the frame was handed to the transport, or exceptionally
     *         with {@link EngineLinkException} if the link is gone.
     */
    CompletableFuture<Void> sendFrame(PlayerSlot slot, byte[] frame);

    /**
     * Requests the next frame from a slot's control link.
     *
     * @param slot The player slot.
     * @return a future for the next frame, completed exceptionally with
     *         {@link EngineLinkException} if the link closes first.
     */
    CompletableFuture<byte[]> recvFrame(PlayerSlot slot);

    /**
     * Registers a callback invoked once if the engine exits without {@link #terminate(Duration)}
     * having been called. Runs on the thread that observed the exit.
     *
     * @param callback The callback.
     */
    void onExit(Runnable callback);

    /**
     * Stops the engine: graceful signal first, forced kill after {@code grace}. Idempotent and
     * safe to call on an engine that never started.
     *
     * @param grace Time allowed for a graceful exit.
     */
    void terminate(Duration grace);
}
