package org.arenaclient.match.resources.engine;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import org.arenaclient.match.api.engine.EngineLinkException;
import org.arenaclient.match.utils.FrameMailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One control link to an engine's WebSocket endpoint.
 * <p>
 * Fragmented binary messages are reassembled into frames. Sends are serialized because the
 * JDK client allows only one outstanding send per socket. When the engine closes the link or it
 * fails, pending and later receives fail with {@link EngineLinkException}.
 */
final class WebSocketEngineLink implements WebSocket.Listener {

    private static final Logger log = LoggerFactory.getLogger(WebSocketEngineLink.class);

    private final URI uri;
    private final int maxFrameSize;
    private final FrameMailbox inbound = new FrameMailbox();
    private final ByteArrayOutputStream partial = new ByteArrayOutputStream();
    private final Object sendLock = new Object();
    private CompletableFuture<Void> sendChain = CompletableFuture.completedFuture(null);
    private volatile WebSocket socket;

    private WebSocketEngineLink(URI uri, int maxFrameSize) {
        this.uri = uri;
        this.maxFrameSize = maxFrameSize;
    }

    /**
     * Opens a link.
     *
     * @param client         HTTP client used for the handshake.
     * @param uri            The endpoint.
     * @param maxFrameSize   Largest accepted frame in bytes.
     * @param connectTimeout Handshake timeout.
     * @return a future for the open link.
     */
    static CompletableFuture<WebSocketEngineLink> connect(HttpClient client, URI uri, int maxFrameSize, Duration connectTimeout) {
        WebSocketEngineLink link = new WebSocketEngineLink(uri, maxFrameSize);
        return client.newWebSocketBuilder()
            .connectTimeout(connectTimeout)
            .buildAsync(uri, link)
            .thenApply(ws -> {
                link.socket = ws;
                return link;
            });
    }

    CompletableFuture<Void> send(byte[] frame) {
        synchronized (sendLock) {
            sendChain = sendChain
                .handle((ignored, previousFailure) -> null)
                .thenCompose(ignored -> {
                    WebSocket ws = socket;
                    if (ws == null || ws.isOutputClosed()) {
                        return CompletableFuture.failedFuture(new EngineLinkException("Control link " + uri + " is closed"));
                    }
                    return ws.sendBinary(ByteBuffer.wrap(frame), true);
                })
                .thenApply(ws -> null);
            return sendChain;
        }
    }

    CompletableFuture<byte[]> next() {
        return inbound.next();
    }

    /**
     * Closes the link and fails pending receives.
     */
    void close() {
        WebSocket ws = socket;
        if (ws != null && !ws.isOutputClosed()) {
            ws.sendClose(WebSocket.NORMAL_CLOSURE, "match ended")
                .exceptionally(t -> {
                    ws.abort();
                    return null;
                });
        }
        inbound.close(new EngineLinkException("Control link " + uri + " closed"));
    }

    /**
     * Fails pending and later receives with the given cause.
     */
    void fail(EngineLinkException cause) {
        inbound.close(cause);
        WebSocket ws = socket;
        if (ws != null) {
            ws.abort();
        }
    }

    @Override
    public void onOpen(WebSocket webSocket) {
        webSocket.request(1);
    }

    @Override
    public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
        if (partial.size() + data.remaining() > maxFrameSize) {
            fail(new EngineLinkException("Engine frame exceeds " + maxFrameSize + " bytes on " + uri));
            return null;
        }
        byte[] chunk = new byte[data.remaining()];
        data.get(chunk);
        partial.write(chunk, 0, chunk.length);
        if (last) {
            byte[] frame = partial.toByteArray();
            partial.reset();
            inbound.deliver(frame);
        }
        webSocket.request(1);
        return null;
    }

    @Override
    public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
        log.debug("Ignoring text message on control link {}", uri);
        webSocket.request(1);
        return null;
    }

    @Override
    public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
        inbound.close(new EngineLinkException("Engine closed control link " + uri + " (" + statusCode + " " + reason + ")"));
        return null;
    }

    @Override
    public void onError(WebSocket webSocket, Throwable error) {
        inbound.close(new EngineLinkException("Control link " + uri + " failed: " + error.getMessage(), error));
    }
}
