package org.arenaclient.match.api.connection;

/**
 * A bidirectional message channel to a bot or supervisor.
 * <p>
 * Wraps the transport's session object so that gateway and session logic can be tested with
 * in-memory fakes. Implementations must allow calls from any thread.
 */
public interface IConnection {

    /**
     * @return a stable identifier of the underlying transport session.
     */
    String id();

    /**
     * Sends a binary frame. Ignored if the connection is closed.
     *
     * @param frame The frame.
     */
    void sendBinary(byte[] frame);

    /**
     * Sends a text message. Ignored if the connection is closed.
     *
     * @param message The message.
     */
    void sendText(String message);

    /**
     * Closes the connection. Idempotent.
     *
     * @param statusCode WebSocket close status.
     * @param reason     Close reason.
     */
    void close(int statusCode, String reason);

    boolean isOpen();
}
