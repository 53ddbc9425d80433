package io.lift.indexer.source;

import io.lift.indexer.supervisor.IndexerConfigurationException;
import java.util.regex.Pattern;

/**
 * One indexed (network, contract, schema) source with its scan tunables.
 */
public record SourceConfig(
    SourceKey key,
    long startHeight,
    int confirmations,
    int batchSize
) {

    public static final long DEFAULT_START_HEIGHT = 0L;
    public static final int DEFAULT_CONFIRMATIONS = 12;
    public static final int DEFAULT_BATCH_SIZE = 1000;

    private static final Pattern ADDRESS_PATTERN = Pattern.compile("^0x[0-9a-f]{40}$");

    public SourceConfig {
        if (key == null) {
            throw new IndexerConfigurationException("source key is required");
        }
        if (key.networkId() <= 0) {
            throw new IndexerConfigurationException("networkId must be > 0: " + key);
        }
        if (!ADDRESS_PATTERN.matcher(key.contractAddress()).matches()) {
            throw new IndexerConfigurationException("Invalid contract address: " + key.contractAddress());
        }
        if (key.schemaKind() == null) {
            throw new IndexerConfigurationException("schemaKind is required for " + key.contractAddress());
        }
        if (startHeight < 0) {
            throw new IndexerConfigurationException("startHeight must be >= 0: " + key);
        }
        if (confirmations < 1) {
            throw new IndexerConfigurationException("confirmations must be >= 1: " + key);
        }
        if (batchSize < 1) {
            throw new IndexerConfigurationException("batchSize must be >= 1: " + key);
        }
    }

    public static SourceConfig of(long networkId, String contractAddress, SchemaKind schemaKind) {
        return new SourceConfig(
            new SourceKey(networkId, contractAddress, schemaKind),
            DEFAULT_START_HEIGHT,
            DEFAULT_CONFIRMATIONS,
            DEFAULT_BATCH_SIZE
        );
    }

    public SourceConfig withStartHeight(long value) {
        return new SourceConfig(key, value, confirmations, batchSize);
    }

    public SourceConfig withConfirmations(int value) {
        return new SourceConfig(key, startHeight, value, batchSize);
    }

    public SourceConfig withBatchSize(int value) {
        return new SourceConfig(key, startHeight, confirmations, value);
    }

    public long networkId() {
        return key.networkId();
    }

    public String contractAddress() {
        return key.contractAddress();
    }

    public SchemaKind schemaKind() {
        return key.schemaKind();
    }
}
