package org.arenaclient.node.processes.gateway;

import java.nio.ByteBuffer;
import java.util.concurrent.atomic.AtomicBoolean;

import org.arenaclient.match.api.connection.IConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.javalin.websocket.WsContext;

/**
 * {@link IConnection} over a Javalin WebSocket session.
 * <p>
 * Sends are synchronized because Jetty allows only one blocking send per session at a time.
 * A failed send marks the connection closed; Javalin reports the close separately.
 */
final class JavalinConnection implements IConnection {

    private static final Logger log = LoggerFactory.getLogger(JavalinConnection.class);

    private final WsContext ctx;
    private final AtomicBoolean open = new AtomicBoolean(true);

    JavalinConnection(WsContext ctx) {
        this.ctx = ctx;
    }

    @Override
    public String id() {
        return ctx.sessionId();
    }

    @Override
    public void sendBinary(byte[] frame) {
        if (!open.get()) {
            return;
        }
        synchronized (this) {
            try {
                ctx.send(ByteBuffer.wrap(frame));
            } catch (Exception e) {
                log.debug("Binary send to {} failed: {}", id(), e.getMessage());
                open.set(false);
            }
        }
    }

    @Override
    public void sendText(String message) {
        if (!open.get()) {
            return;
        }
        synchronized (this) {
            try {
                ctx.send(message);
            } catch (Exception e) {
                log.debug("Text send to {} failed: {}", id(), e.getMessage());
                open.set(false);
            }
        }
    }

    @Override
    public void close(int statusCode, String reason) {
        if (!open.compareAndSet(true, false)) {
            return;
        }
        synchronized (this) {
            try {
                ctx.closeSession(statusCode, reason);
            } catch (Exception e) {
                log.debug("Close of {} failed: {}", id(), e.getMessage());
            }
        }
    }

    @Override
    public boolean isOpen() {
        return open.get();
    }

    void markClosed() {
        open.set(false);
    }
}
