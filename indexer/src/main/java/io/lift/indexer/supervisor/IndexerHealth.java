package io.lift.indexer.supervisor;

import java.time.Instant;
import java.util.List;

public record IndexerHealth(
    boolean healthy,
    boolean running,
    int activePollerCount,
    List<SourceHealth> sources,
    long failedEvents,
    long eventsNeedingIntervention,
    List<String> issues,
    Instant checkedAt
) {

    public IndexerHealth {
        sources = sources == null ? List.of() : List.copyOf(sources);
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public String summary() {
        if (healthy) {
            return "healthy: " + activePollerCount + " active poller(s)";
        }
        return "unhealthy: " + String.join("; ", issues);
    }
}
