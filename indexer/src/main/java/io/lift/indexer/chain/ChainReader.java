package io.lift.indexer.chain;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of a chain node. Every call is a fresh remote read and fails with {@link ChainReaderException}.
 */
public interface ChainReader {

    long headHeight(long networkId);

    /**
     * Logs emitted by {@code contractAddress} in the inclusive range, ordered by block number then log index.
     */
    List<RawLog> getLogs(long networkId, String contractAddress, long fromHeight, long toHeight);

    Instant blockTimestamp(long networkId, String blockHash);

    boolean supportsNetwork(long networkId);
}
