package io.lift.indexer.event;

/**
 * Typed arguments of one decoded event. Implementations are keyed by event name in {@link EventPayloadCodec}.
 */
public interface EventPayload {

    String eventName();
}
