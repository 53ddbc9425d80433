package io.lift.indexer.supervisor;

import io.lift.indexer.source.SourceKey;
import java.time.Instant;

public record SourceHealth(
    SourceKey key,
    boolean active,
    long lastProcessedHeight,
    Instant lastSyncAt,
    int errorCount,
    String lastError,
    boolean erroring,
    boolean stale
) {

    public boolean healthy() {
        return !erroring && !stale;
    }
}
