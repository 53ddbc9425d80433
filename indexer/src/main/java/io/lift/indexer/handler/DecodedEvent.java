package io.lift.indexer.handler;

import io.lift.indexer.event.EventPayload;
import io.lift.indexer.source.SchemaKind;
import io.lift.indexer.store.IndexedEvent;
import java.time.Instant;
import java.util.UUID;

/**
 * What a handler sees of a stored event: its identity, position on chain and typed payload.
 */
public record DecodedEvent(
    UUID eventId,
    long networkId,
    String contractAddress,
    SchemaKind schemaKind,
    String txHash,
    long blockNumber,
    long logIndex,
    Instant blockTimestamp,
    EventPayload payload
) {

    public static DecodedEvent from(IndexedEvent event) {
        return new DecodedEvent(
            event.id(),
            event.networkId(),
            event.contractAddress(),
            event.schemaKind(),
            event.txHash(),
            event.blockNumber(),
            event.logIndex(),
            event.blockTimestamp(),
            event.decodedArgs()
        );
    }

    public String eventName() {
        return payload.eventName();
    }
}
