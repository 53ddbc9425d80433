package io.lift.indexer.chain;

/**
 * Node unreachable or returned an error / malformed response.
 */
public class ChainReaderException extends RuntimeException {

    public ChainReaderException(String message) {
        super(message);
    }

    public ChainReaderException(String message, Throwable cause) {
        super(message, cause);
    }
}
