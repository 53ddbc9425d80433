package io.lift.indexer.store;

public record EventFilter(
    Long networkId,
    String contractAddress,
    String eventName,
    Boolean processed,
    Boolean hasError,
    EventProcessingStatus status,
    Integer limit,
    Integer offset
) {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 100;

    public static EventFilter all() {
        return new EventFilter(null, null, null, null, null, null, null, null);
    }

    public static EventFilter byStatus(EventProcessingStatus status) {
        return new EventFilter(null, null, null, null, null, status, null, null);
    }

    public int effectiveLimit() {
        if (limit == null || limit <= 0) {
            return DEFAULT_LIMIT;
        }
        return Math.min(limit, MAX_LIMIT);
    }

    public int effectiveOffset() {
        return offset == null ? 0 : Math.max(0, offset);
    }
}
