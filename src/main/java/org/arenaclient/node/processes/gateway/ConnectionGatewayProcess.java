package org.arenaclient.node.processes.gateway;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.arenaclient.match.api.resources.OperationalError;
import org.arenaclient.match.model.PlayerSlot;
import org.arenaclient.match.services.InstanceCoordinator;
import org.arenaclient.match.session.MatchSession;
import org.arenaclient.node.processes.AbstractProcess;
import org.arenaclient.node.processes.gateway.ConnectionGateway.Handshake;

import com.typesafe.config.Config;

import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import io.javalin.websocket.WsContext;

/**
 * Node process that serves the WebSocket endpoint for supervisors and bots, and the health
 * endpoint.
 * <p>
 * <strong>Configuration:</strong>
 * <pre>
 * gateway {
 *   className = "org.arenaclient.node.processes.gateway.ConnectionGatewayProcess"
 *   require { coordinator = "match-coordinator" }
 *   options {
 *     host = "127.0.0.1"
 *     port = 8642
 *     path = "/sc2api"
 *     maxMessageSize = 64 MiB
 *     idleTimeout = 10 minutes
 *   }
 * }
 * </pre>
 */
public class ConnectionGatewayProcess extends AbstractProcess {

    static final String STATUS_PATH = "/api/status";

    private final InstanceCoordinator coordinator;
    private final ConnectionGateway gateway;
    private final String host;
    private final int port;
    private final String path;
    private final long maxMessageSize;
    private final Duration idleTimeout;
    private final Map<String, JavalinConnection> connections = new ConcurrentHashMap<>();
    private Javalin app;

    public ConnectionGatewayProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        super(processName, dependencies, options);
        this.coordinator = getDependency("coordinator", InstanceCoordinator.class);
        this.gateway = new ConnectionGateway(coordinator);
        this.host = options.hasPath("host") ? options.getString("host") : "127.0.0.1";
        this.port = options.hasPath("port") ? options.getInt("port") : 8642;
        this.path = options.hasPath("path") ? options.getString("path") : "/sc2api";
        this.maxMessageSize = options.hasPath("maxMessageSize") ? options.getMemorySize("maxMessageSize").toBytes() : 64L * 1024 * 1024;
        this.idleTimeout = options.hasPath("idleTimeout") ? options.getDuration("idleTimeout") : Duration.ofMinutes(10);
    }

    @Override
    public void start() {
        app = createApp();
        app.start(host, port);
        log.info("Gateway listening on ws://{}:{}{} (status at {})", host, app.port(), path, STATUS_PATH);
    }

    @Override
    public void stop() {
        if (app != null) {
            app.stop();
            app = null;
            log.info("Gateway stopped");
        }
    }

    /**
     * @return the bound port, which differs from the configured one if that was 0.
     */
    public int getPort() {
        return app != null ? app.port() : port;
    }

    Javalin createApp() {
        Javalin javalin = Javalin.create(config -> {
            config.showJavalinBanner = false;
            config.jetty.modifyWebSocketServletFactory(factory -> {
                factory.setMaxBinaryMessageSize(maxMessageSize);
                factory.setMaxTextMessageSize(maxMessageSize);
                factory.setIdleTimeout(idleTimeout);
            });
        });

        javalin.ws(path, ws -> {
            ws.onConnect(ctx -> {
                JavalinConnection connection = new JavalinConnection(ctx);
                connections.put(ctx.sessionId(), connection);
                gateway.onConnect(connection, handshake(ctx));
            });
            ws.onMessage(ctx -> {
                JavalinConnection connection = connections.get(ctx.sessionId());
                if (connection != null) {
                    gateway.onText(connection, ctx.message());
                }
            });
            ws.onBinaryMessage(ctx -> {
                JavalinConnection connection = connections.get(ctx.sessionId());
                if (connection != null) {
                    byte[] frame = new byte[ctx.length()];
                    System.arraycopy(ctx.data(), ctx.offset(), frame, 0, ctx.length());
                    gateway.onBinary(connection, frame);
                }
            });
            ws.onClose(ctx -> {
                JavalinConnection connection = connections.remove(ctx.sessionId());
                if (connection != null) {
                    connection.markClosed();
                    gateway.onClose(connection, ctx.status(), ctx.reason());
                }
            });
            ws.onError(ctx -> log.debug("WebSocket error on {}: {}", ctx.sessionId(),
                ctx.error() != null ? ctx.error().getMessage() : "unknown"));
        });

        javalin.get(STATUS_PATH, this::handleStatus);
        return javalin;
    }

    void handleStatus(final Context ctx) {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("state", coordinator.getCurrentState().name());
        status.put("healthy", coordinator.isHealthy());
        status.put("metrics", coordinator.getMetrics());
        status.put("leasedPorts", coordinator.getPorts().getLeasedPorts());
        status.put("connections", gateway.getConnectionCounts());

        List<Map<String, Object>> errors = new ArrayList<>();
        for (OperationalError error : coordinator.getErrors()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("timestamp", error.timestamp().toString());
            entry.put("code", error.code());
            entry.put("message", error.message());
            entry.put("details", error.details());
            errors.add(entry);
        }
        status.put("errors", errors);

        List<Map<String, Object>> sessions = new ArrayList<>();
        for (MatchSession session : coordinator.getSessions()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", session.getId());
            entry.put("matchId", session.getConfig().getMatchId());
            entry.put("state", session.getState().name());
            entry.put("map", session.getConfig().getMapName());
            entry.put("player1", session.getConfig().getPlayer(PlayerSlot.PLAYER_1));
            entry.put("player2", session.getConfig().getPlayer(PlayerSlot.PLAYER_2));
            entry.put("port", session.getPort());
            sessions.add(entry);
        }
        status.put("sessions", sessions);
        ctx.status(HttpStatus.OK).json(status);
    }

    private static Handshake handshake(final WsContext ctx) {
        String role = ctx.header("role");
        if (role == null) {
            role = ctx.queryParam("role");
        }
        String player = ctx.header("player");
        if (player == null) {
            player = ctx.queryParam("player");
        }
        return new Handshake(ctx.header("supervisor") != null, role, player);
    }
}
