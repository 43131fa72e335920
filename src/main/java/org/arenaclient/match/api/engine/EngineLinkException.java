package org.arenaclient.match.api.engine;

/**
 * Thrown when a control link to a running engine fails, for example because the engine closed it.
 */
public class EngineLinkException extends RuntimeException {

    /**
     * @param message Description of the failure.
     */
    public EngineLinkException(String message) {
        super(message);
    }

    /**
     * @param message Description of the failure.
     * @param cause   The underlying cause.
     */
    public EngineLinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
