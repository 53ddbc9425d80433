package io.lift.indexer.poller;

public record TickResult(
    Status status,
    ScanRange range,
    int fetchedLogs,
    int insertedEvents,
    int duplicateEvents,
    int undecodedEvents,
    int processedEvents,
    int failedEvents,
    String error
) {

    public enum Status {
        BUSY,
        INACTIVE,
        NO_NEW_RANGE,
        ADVANCED,
        FAILED
    }

    static TickResult of(Status status) {
        return new TickResult(status, null, 0, 0, 0, 0, 0, 0, null);
    }

    static TickResult failed(ScanRange range, String error) {
        return new TickResult(Status.FAILED, range, 0, 0, 0, 0, 0, 0, error);
    }
}
