package io.lift.indexer.store;

import io.lift.indexer.event.EventPayload;
import io.lift.indexer.source.SchemaKind;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record IndexedEvent(
    UUID id,
    long networkId,
    String contractAddress,
    SchemaKind schemaKind,
    String eventName,
    String eventSignature,
    long blockNumber,
    String blockHash,
    Instant blockTimestamp,
    String txHash,
    long txIndex,
    long logIndex,
    List<String> rawTopics,
    String rawData,
    EventPayload decodedArgs,
    String decodeError,
    boolean processed,
    Instant processedAt,
    String processingError,
    int retryCount,
    int maxRetries,
    Instant createdAt
) {

    public IndexedEvent {
        rawTopics = rawTopics == null ? List.of() : List.copyOf(rawTopics);
    }

    public EventProcessingStatus status() {
        return EventProcessingStatus.of(processed, eventName, processingError, retryCount, maxRetries);
    }

    public String dedupKey() {
        return networkId + ":" + txHash + ":" + logIndex;
    }
}
