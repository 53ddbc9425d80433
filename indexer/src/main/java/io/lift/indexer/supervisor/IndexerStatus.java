package io.lift.indexer.supervisor;

import io.lift.indexer.store.CursorRecord;
import java.util.List;

public record IndexerStatus(boolean running, int activePollerCount, List<CursorRecord> cursors) {

    public IndexerStatus {
        cursors = cursors == null ? List.of() : List.copyOf(cursors);
    }
}
