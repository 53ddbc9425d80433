package io.lift.indexer.store;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only audit log of observed events. Outcome updates are conditional on the retry count the caller read, so a
 * sweep and a poller never both apply an outcome to the same attempt.
 */
public interface EventStore {

    /**
     * @return the stored row, or empty when (networkId, txHash, logIndex) already exists
     */
    Optional<IndexedEvent> insertIfAbsent(NewIndexedEvent event);

    Optional<IndexedEvent> findByLogKey(long networkId, String txHash, long logIndex);

    boolean markProcessed(UUID id, int expectedRetryCount, Instant now);

    /**
     * Records the error and increments the retry count, never beyond the row's max retries.
     */
    boolean markFailed(UUID id, int expectedRetryCount, String error);

    /**
     * Failed, unprocessed rows below their retry cap, oldest first.
     */
    List<IndexedEvent> findRetryable(int limit);

    Optional<IndexedEvent> findById(UUID id);

    EventPage find(EventFilter filter);

    long countByStatus(EventProcessingStatus status);
}
