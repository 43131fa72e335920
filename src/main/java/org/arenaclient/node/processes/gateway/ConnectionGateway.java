package org.arenaclient.node.processes.gateway;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.arenaclient.match.api.connection.IConnection;
import org.arenaclient.match.model.MatchConfig;
import org.arenaclient.match.model.MatchConfigException;
import org.arenaclient.match.protocol.EngineStatus;
import org.arenaclient.match.protocol.FrameCodec;
import org.arenaclient.match.protocol.MessageKind;
import org.arenaclient.match.protocol.ProtocolDecodeException;
import org.arenaclient.match.protocol.RequestFrame;
import org.arenaclient.match.protocol.SupervisorMessages;
import org.arenaclient.match.services.InstanceCoordinator;
import org.arenaclient.match.services.InstanceCoordinator.BotRoute;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies incoming connections and routes their traffic.
 * <p>
 * A connection is a supervisor if its handshake carries a {@code supervisor} header or
 * {@code role=supervisor}; {@code role=bot} or no marker makes it a bot, any other role is
 * refused. Supervisors speak the JSON text protocol of {@link SupervisorMessages}. Bots speak
 * the engine's binary control protocol; until their {@code join_game} request has placed them
 * in a session, only {@code ping} and {@code quit} are answered.
 * <p>
 * Transport independent; {@link ConnectionGatewayProcess} binds it to Javalin.
 */
public class ConnectionGateway {

    static final int CLOSE_NORMAL = 1000;
    static final int CLOSE_UNSUPPORTED_DATA = 1003;
    static final int CLOSE_POLICY_VIOLATION = 1008;
    static final int CLOSE_TRY_AGAIN_LATER = 1013;

    private static final Logger log = LoggerFactory.getLogger(ConnectionGateway.class);

    private final InstanceCoordinator coordinator;
    private final Map<String, Peer> peers = new ConcurrentHashMap<>();

    public ConnectionGateway(InstanceCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    public enum Role {
        SUPERVISOR,
        BOT
    }

    /**
     * What a peer presented when connecting.
     *
     * @param supervisorMarker Whether a {@code supervisor} header was present.
     * @param role             The {@code role} header or query parameter, or {@code null}.
     * @param player           The {@code player} header or query parameter, or {@code null}.
     */
    public record Handshake(boolean supervisorMarker, String role, String player) {
    }

    /**
     * @param handshake The handshake.
     * @return the peer's role, or empty if the handshake names an unknown role.
     */
    public static Optional<Role> classify(Handshake handshake) {
        if (handshake.supervisorMarker()) {
            return Optional.of(Role.SUPERVISOR);
        }
        String role = handshake.role();
        if (role == null || role.isBlank()) {
            return Optional.of(Role.BOT);
        }
        return switch (role.trim().toLowerCase(Locale.ROOT)) {
            case "supervisor" -> Optional.of(Role.SUPERVISOR);
            case "bot" -> Optional.of(Role.BOT);
            default -> Optional.empty();
        };
    }

    public void onConnect(IConnection connection, Handshake handshake) {
        Optional<Role> role = classify(handshake);
        if (role.isEmpty()) {
            log.warn("Refusing connection {} with unknown role '{}'", connection.id(), handshake.role());
            connection.close(CLOSE_POLICY_VIOLATION, "Unknown role");
            return;
        }
        peers.put(connection.id(), new Peer(role.get(), connection, handshake.player()));
        if (role.get() == Role.SUPERVISOR) {
            log.info("Supervisor connected: {}", connection.id());
            connection.sendText(SupervisorMessages.connected());
        } else {
            log.debug("Bot connected: {}", connection.id());
        }
    }

    public void onText(IConnection connection, String message) {
        Peer peer = peers.get(connection.id());
        if (peer == null) {
            return;
        }
        if (peer.role == Role.BOT) {
            log.warn("Bot {} sent a text message, closing", connection.id());
            connection.close(CLOSE_UNSUPPORTED_DATA, "Bots must send binary protocol frames");
            return;
        }

        String text = message.trim();
        if (text.equals(SupervisorMessages.PING)) {
            connection.sendText(SupervisorMessages.PONG);
        } else if (text.equals(SupervisorMessages.QUIT) || text.equals(SupervisorMessages.RESET)) {
            coordinator.abortRequestsOf(connection, "Supervisor sent " + text);
        } else if (text.startsWith("{")) {
            submit(connection, text);
        } else {
            connection.sendText(SupervisorMessages.error("Unknown message"));
        }
    }

    public void onBinary(IConnection connection, byte[] frame) {
        Peer peer = peers.get(connection.id());
        if (peer == null) {
            return;
        }
        if (peer.role == Role.SUPERVISOR) {
            connection.sendText(SupervisorMessages.error("Binary messages are not accepted from a supervisor"));
            return;
        }
        BotRoute route = peer.route;
        if (route != null) {
            route.session().deliver(route.slot(), frame);
            return;
        }

        RequestFrame request;
        try {
            request = FrameCodec.decodeRequest(frame);
        } catch (ProtocolDecodeException e) {
            log.warn("Closing bot {}: {}", connection.id(), e.getMessage());
            connection.close(CLOSE_POLICY_VIOLATION, "Malformed frame");
            return;
        }

        switch (request.kind()) {
            case PING -> connection.sendBinary(
                FrameCodec.emptyResponse(MessageKind.PING, request.id(), EngineStatus.LAUNCHED));
            case QUIT -> {
                connection.sendBinary(FrameCodec.emptyResponse(MessageKind.QUIT, request.id(), EngineStatus.QUIT));
                connection.close(CLOSE_NORMAL, "Quit");
            }
            case JOIN_GAME -> join(peer, request);
            default -> {
                log.warn("Bot {} sent {} before joining, closing", connection.id(), request.kind());
                connection.close(CLOSE_POLICY_VIOLATION, "Expected join_game");
            }
        }
    }

    public void onClose(IConnection connection, int statusCode, String reason) {
        Peer peer = peers.remove(connection.id());
        if (peer == null) {
            return;
        }
        log.debug("{} {} closed ({} {})", peer.role, connection.id(), statusCode, reason);
        if (peer.role == Role.SUPERVISOR) {
            coordinator.abortRequestsOf(connection, "Supervisor disconnected");
        } else if (peer.route != null) {
            peer.route.session().botDisconnected(peer.route.slot());
        }
    }

    /**
     * @return the number of open connections by role.
     */
    public Map<Role, Long> getConnectionCounts() {
        Map<Role, Long> counts = new EnumMap<>(Role.class);
        for (Role role : Role.values()) {
            counts.put(role, peers.values().stream().filter(p -> p.role == role).count());
        }
        return counts;
    }

    private void submit(IConnection connection, String json) {
        if (coordinator.hasOutstandingRequest(connection)) {
            connection.sendText(SupervisorMessages.error("A match request is already outstanding"));
            return;
        }
        MatchConfig config;
        try {
            config = MatchConfig.fromJson(json);
        } catch (MatchConfigException e) {
            log.warn("Rejecting invalid match configuration from {}: {}", connection.id(), e.getMessage());
            connection.sendText(SupervisorMessages.rejected(e.getMessage()));
            return;
        }
        log.info("Match request from {}: {}", connection.id(), config);
        coordinator.submit(connection, config);
    }

    private void join(Peer peer, RequestFrame request) {
        IConnection connection = peer.connection;
        Optional<BotRoute> route = coordinator.routeBot(connection, request, peer.playerHint);
        if (route.isEmpty()) {
            log.warn("No session awaits bot {} ('{}'), closing", connection.id(), request.playerName());
            connection.close(CLOSE_TRY_AGAIN_LATER, "No match is awaiting players");
            return;
        }
        peer.route = route.get();
    }

    private static final class Peer {
        private final Role role;
        private final IConnection connection;
        private final String playerHint;
        private volatile BotRoute route;

        Peer(Role role, IConnection connection, String playerHint) {
            this.role = role;
            this.connection = connection;
            this.playerHint = playerHint;
        }
    }
}
