package io.lift.indexer.store;

import io.lift.indexer.source.SourceKey;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable per-source scan position. All writes for one key come from that source's poller.
 */
public interface CursorStore {

    Optional<CursorRecord> find(SourceKey key);

    List<CursorRecord> findAll();

    /**
     * Creates the cursor at height 0 when absent. An existing cursor keeps its height and is re-activated.
     */
    CursorRecord ensureActive(SourceKey key, Instant now);

    /**
     * Moves the cursor forward and clears the error state. A height lower than the stored one is ignored.
     */
    void advance(SourceKey key, long lastProcessedHeight, Instant now);

    void recordError(SourceKey key, String message, Instant now);

    void setActive(SourceKey key, boolean active, Instant now);
}
