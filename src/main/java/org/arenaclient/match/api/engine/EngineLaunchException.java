package org.arenaclient.match.api.engine;

/**
 * Thrown when the engine process cannot be started or its control endpoint never becomes reachable.
 */
public class EngineLaunchException extends RuntimeException {

    /**
     * @param message Description of the failure.
     */
    public EngineLaunchException(String message) {
        super(message);
    }

    /**
     * @param message Description of the failure.
     * @param cause   The underlying cause.
     */
    public EngineLaunchException(String message, Throwable cause) {
        super(message, cause);
    }
}
