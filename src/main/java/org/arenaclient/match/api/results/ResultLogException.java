package org.arenaclient.match.api.results;

/**
 * Thrown when a match result cannot be written to or read from the result log.
 */
public class ResultLogException extends RuntimeException {

    /**
     * @param message Description of the failure.
     */
    public ResultLogException(String message) {
        super(message);
    }

    /**
     * @param message Description of the failure.
     * @param cause   The underlying cause.
     */
    public ResultLogException(String message, Throwable cause) {
        super(message, cause);
    }
}
