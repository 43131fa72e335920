package org.arenaclient.match.api.connection;

/**
 * Completes a bot's pending frame request when its connection goes away.
 */
public class BotDisconnectedException extends RuntimeException {

    /**
     * @param message Description of the failure.
     */
    public BotDisconnectedException(String message) {
        super(message);
    }

    /**
     * @param message Description of the failure.
     * @param cause   The underlying cause.
     */
    public BotDisconnectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
