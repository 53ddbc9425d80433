package io.lift.indexer.store;

import io.lift.indexer.chain.RawLog;
import io.lift.indexer.decoder.DecodeResult;
import io.lift.indexer.event.EventPayload;
import io.lift.indexer.source.SourceConfig;
import io.lift.indexer.source.SchemaKind;
import java.time.Instant;
import java.util.List;

/**
 * Row to be inserted for one observed log, deduplicated on (networkId, txHash, logIndex).
 */
public record NewIndexedEvent(
    long networkId,
    String contractAddress,
    SchemaKind schemaKind,
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
    int maxRetries
) {

    public static NewIndexedEvent from(
        SourceConfig source,
        RawLog log,
        Instant blockTimestamp,
        DecodeResult decoded,
        int maxRetries
    ) {
        return new NewIndexedEvent(
            source.networkId(),
            source.contractAddress(),
            source.schemaKind(),
            log.topic0(),
            log.blockNumber(),
            log.blockHash(),
            blockTimestamp,
            log.txHash(),
            log.txIndex(),
            log.logIndex(),
            log.topics(),
            log.data(),
            decoded.payload(),
            decoded.error(),
            maxRetries
        );
    }

    public String eventName() {
        return decodedArgs.eventName();
    }
}
