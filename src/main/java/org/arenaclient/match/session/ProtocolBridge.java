package org.arenaclient.match.session;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.arenaclient.match.api.engine.EngineLinkException;
import org.arenaclient.match.api.engine.IEngine;
import org.arenaclient.match.model.GamePorts;
import org.arenaclient.match.model.PlayerSlot;
import org.arenaclient.match.protocol.EngineStatus;
import org.arenaclient.match.protocol.FrameCodec;
import org.arenaclient.match.protocol.MessageKind;
import org.arenaclient.match.protocol.ProtocolDecodeException;
import org.arenaclient.match.protocol.RequestFrame;
import org.arenaclient.match.protocol.ResponseFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Relays control-protocol frames between the bots and the engine.
 * <p>
 * Bot frames reach the engine verbatim unless they are debug commands while debug is disabled,
 * or surrender requests, both of which are answered locally. Engine responses reach the bot
 * verbatim. Frames are classified only as far as session control needs.
 */
public class ProtocolBridge {

    private static final Logger log = LoggerFactory.getLogger(ProtocolBridge.class);

    private final IEngine engine;
    private final boolean disableDebug;
    private final Duration engineResponseTimeout;
    private final Executor executor;

    /**
     * @param engine                The engine.
     * @param disableDebug          Whether debug commands are filtered.
     * @param engineResponseTimeout Bound on one engine round trip.
     * @param executor              Executor for forwarding engine responses to bots.
     */
    public ProtocolBridge(IEngine engine, boolean disableDebug, Duration engineResponseTimeout, Executor executor) {
        this.engine = engine;
        this.disableDebug = disableDebug;
        this.engineResponseTimeout = engineResponseTimeout;
        this.executor = executor;
    }

    /**
     * Relays one bot frame and the engine's answer to it.
     *
     * @param bot   The sending bot.
     * @param frame The bot's frame.
     * @return the exchange; never completes exceptionally.
     */
    public CompletableFuture<Exchange> relay(BotChannel bot, byte[] frame) {
        PlayerSlot slot = bot.slot();
        RequestFrame request;
        try {
            request = FrameCodec.decodeRequest(frame);
        } catch (ProtocolDecodeException e) {
            log.debug("Undecodable frame from slot {}: {}", slot.number(), e.getMessage());
            bot.send(FrameCodec.errorResponse(e.getMessage()));
            return CompletableFuture.completedFuture(Exchange.decodeError(slot, e.getMessage()));
        }

        if (disableDebug && request.kind().isDebug()) {
            log.debug("Filtered debug request {} from slot {}", request.id(), slot.number());
            bot.send(FrameCodec.debugRejection(request.id()));
            return CompletableFuture.completedFuture(Exchange.filtered(slot, request));
        }

        if (request.kind().isSurrender()) {
            EngineStatus status = request.kind() == MessageKind.QUIT ? EngineStatus.QUIT : EngineStatus.LAUNCHED;
            bot.send(FrameCodec.emptyResponse(request.kind(), request.id(), status));
            return CompletableFuture.completedFuture(Exchange.surrendered(slot, request));
        }

        return roundTrip(slot, frame)
            .thenApplyAsync(response -> {
                bot.send(response);
                return Exchange.relayed(slot, request, classify(response));
            }, executor)
            .exceptionally(t -> Exchange.engineFailure(slot, request, describe(unwrap(t))));
    }

    /**
     * Creates the game over one player's link, with every player a participant. The bots join it
     * afterwards with {@link #join}.
     *
     * @param host     The slot whose link creates the game.
     * @param mapFile  Map file, relative to the engine's map directory.
     * @param realTime Whether the game runs in real time.
     * @return a future completed once the engine has created the game.
     */
    public CompletableFuture<Void> createGame(PlayerSlot host, String mapFile, boolean realTime) {
        byte[] request = FrameCodec.createGameRequest(mapFile, realTime, PlayerSlot.values().length);
        return roundTrip(host, request)
            .thenAccept(response -> {
                ResponseFrame created = FrameCodec.decodeResponse(response);
                if (!created.errors().isEmpty()) {
                    throw new EngineLinkException("Engine could not create a game on '" + mapFile + "': "
                        + String.join("; ", created.errors()));
                }
                log.debug("Game created on '{}' over slot {}", mapFile, host.number());
            });
    }

    /**
     * Forwards a bot's buffered join request with the match's ports and reads the player id the
     * engine assigned.
     *
     * @param bot   The bot.
     * @param ports The ports the engine instances of the match connect over.
     * @return a future completed once the bot has received the engine's join response.
     */
    public CompletableFuture<Integer> join(BotChannel bot, GamePorts ports) {
        return roundTrip(bot.slot(), FrameCodec.withGamePorts(bot.joinRequest().raw(), ports))
            .thenApplyAsync(response -> {
                ResponseFrame join = FrameCodec.decodeResponse(response);
                if (!join.errors().isEmpty()) {
                    throw new EngineLinkException("Engine refused join of slot " + bot.slot().number()
                        + ": " + String.join("; ", join.errors()));
                }
                bot.send(response);
                return join.playerId() > 0 ? join.playerId() : bot.slot().number();
            }, executor);
    }

    /**
     * Asks the engine for the replay over a slot's link.
     *
     * @param slot The slot whose link is used.
     * @return a future for the replay bytes, empty if the engine sent none.
     */
    public CompletableFuture<byte[]> saveReplay(PlayerSlot slot) {
        return roundTrip(slot, FrameCodec.emptyRequest(MessageKind.SAVE_REPLAY))
            .thenApply(response -> {
                byte[] data = FrameCodec.decodeResponse(response).replayData();
                return data == null ? new byte[0] : data;
            });
    }

    private CompletableFuture<byte[]> roundTrip(PlayerSlot slot, byte[] frame) {
        return engine.sendFrame(slot, frame)
            .thenCompose(ignored -> engine.recvFrame(slot))
            .orTimeout(engineResponseTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private static ResponseFrame classify(byte[] response) {
        try {
            return FrameCodec.decodeResponse(response);
        } catch (ProtocolDecodeException e) {
            // the bot got the frame anyway; session control just learns nothing from it
            log.debug("Unclassifiable engine response: {}", e.getMessage());
            return null;
        }
    }

    static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable t) {
        if (t instanceof TimeoutException) {
            return "Engine did not answer within the response timeout";
        }
        return t.getClass().getSimpleName() + ": " + t.getMessage();
    }
}
