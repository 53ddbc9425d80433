package io.lift.indexer.source;

import java.util.Locale;

/**
 * Natural key of a source and of its cursor row. Address is stored lower-cased so comparisons are case-insensitive.
 */
public record SourceKey(long networkId, String contractAddress, SchemaKind schemaKind) {

    public SourceKey {
        contractAddress = normalizeAddress(contractAddress);
    }

    public static String normalizeAddress(String address) {
        if (address == null) {
            return "";
        }
        return address.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return networkId + ":" + contractAddress + ":" + schemaKind;
    }
}
