package org.arenaclient.match.protocol;

/**
 * Thrown when a frame is not a well-formed control-protocol message.
 */
public class ProtocolDecodeException extends RuntimeException {

    /**
     * @param message Description of the decode failure.
     */
    public ProtocolDecodeException(String message) {
        super(message);
    }

    /**
     * @param message Description of the decode failure.
     * @param cause   The underlying protobuf error.
     */
    public ProtocolDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
