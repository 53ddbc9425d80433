package io.lift.indexer.handler;

import io.lift.indexer.source.SchemaKind;

/**
 * Applies the side effects of one decoded event. Implementations must be idempotent per event id: the same
 * event can be applied again after a crash or by the retry sweep.
 */
public interface BusinessHandler {

    SchemaKind schemaKind();

    HandlerResult apply(DecodedEvent event);
}
