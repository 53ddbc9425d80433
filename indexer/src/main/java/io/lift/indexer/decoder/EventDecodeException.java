package io.lift.indexer.decoder;

/**
 * Log does not match the ABI of the event its topic0 points at.
 */
public class EventDecodeException extends RuntimeException {

    public EventDecodeException(String message) {
        super(message);
    }

    public EventDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
