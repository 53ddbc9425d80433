package io.lift.indexer.handler;

public enum DispatchOutcome {
    PROCESSED,
    FAILED,
    /** Undecoded or already processed; the handler was not called. */
    SKIPPED,
    /** The handler ran but another writer changed the row first, so the outcome was not recorded. */
    CONFLICT,
    /** The handler pool never ran the handler, so no attempt was recorded and the row is unchanged. */
    NOT_STARTED
}
