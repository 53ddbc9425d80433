package io.lift.indexer.chain;

import java.util.List;
import java.util.Locale;

public record RawLog(
    String txHash,
    long logIndex,
    long blockNumber,
    String blockHash,
    long txIndex,
    String contractAddress,
    List<String> topics,
    String data
) {

    public RawLog {
        txHash = normalizeHex(txHash);
        blockHash = normalizeHex(blockHash);
        contractAddress = normalizeHex(contractAddress);
        topics = topics == null ? List.of() : List.copyOf(topics);
        data = data == null || data.isBlank() ? "0x" : data;
    }

    public String topic0() {
        return topics.isEmpty() ? "" : normalizeHex(topics.get(0));
    }

    private static String normalizeHex(String value) {
        if (value == null) {
            return "";
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
