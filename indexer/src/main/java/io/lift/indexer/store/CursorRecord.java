package io.lift.indexer.store;

import io.lift.indexer.source.SourceKey;
import java.time.Instant;
import java.util.UUID;

public record CursorRecord(
    UUID id,
    SourceKey key,
    long lastProcessedHeight,
    Instant lastSyncAt,
    boolean active,
    int errorCount,
    String lastError,
    Instant lastErrorAt,
    Instant createdAt,
    Instant updatedAt
) {
}
