package io.lift.indexer.supervisor;

/**
 * Invalid or duplicate source configuration. Raised at start time, never swallowed.
 */
public class IndexerConfigurationException extends RuntimeException {

    public IndexerConfigurationException(String message) {
        super(message);
    }
}
