package io.lift.indexer.store;

import io.lift.indexer.event.UnknownPayload;

/**
 * Lifecycle of a stored event: PENDING -> PROCESSED, or PENDING -> FAILED(n) ... -> NEEDS_MANUAL_INTERVENTION once
 * the retry cap is reached. UNDECODED rows are kept for audit and never dispatched.
 */
public enum EventProcessingStatus {
    PENDING,
    PROCESSED,
    FAILED,
    NEEDS_MANUAL_INTERVENTION,
    UNDECODED;

    public static EventProcessingStatus of(
        boolean processed,
        String eventName,
        String processingError,
        int retryCount,
        int maxRetries
    ) {
        if (processed) {
            return PROCESSED;
        }
        if (processingError != null) {
            return retryCount >= maxRetries ? NEEDS_MANUAL_INTERVENTION : FAILED;
        }
        if (UnknownPayload.EVENT_NAME.equals(eventName)) {
            return UNDECODED;
        }
        return PENDING;
    }

    String sqlPredicate() {
        return switch (this) {
            case PROCESSED -> "processed = TRUE";
            case FAILED -> "processed = FALSE AND processing_error IS NOT NULL AND retry_count < max_retries";
            case NEEDS_MANUAL_INTERVENTION ->
                "processed = FALSE AND processing_error IS NOT NULL AND retry_count >= max_retries";
            case UNDECODED -> "processed = FALSE AND processing_error IS NULL AND event_name = 'Unknown'";
            case PENDING -> "processed = FALSE AND processing_error IS NULL AND event_name <> 'Unknown'";
        };
    }
}
