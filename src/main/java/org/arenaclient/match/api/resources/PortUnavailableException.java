package org.arenaclient.match.api.resources;

/**
 * Thrown when the port pool has no free, bindable port left.
 */
public class PortUnavailableException extends RuntimeException {

    /**
     * @param message Description of the failure.
     */
    public PortUnavailableException(String message) {
        super(message);
    }

    /**
     * @param message Description of the failure.
     * @param cause   The underlying cause.
     */
    public PortUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
