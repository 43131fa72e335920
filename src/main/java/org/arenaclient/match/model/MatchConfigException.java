package org.arenaclient.match.model;

/**
 * Thrown when a supervisor's match configuration cannot be parsed or is invalid.
 */
public class MatchConfigException extends RuntimeException {

    /**
     * @param message The reason the configuration was refused.
     */
    public MatchConfigException(String message) {
        super(message);
    }

    /**
     * @param message The reason the configuration was refused.
     * @param cause   The underlying parse failure.
     */
    public MatchConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
