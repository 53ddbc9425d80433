package io.lift.indexer.source;

import java.util.Locale;

public enum SchemaKind {
    REPAYMENT_ESCROW,
    ALLOCATION_ESCROW,
    LIFT_UNITS;

    /**
     * Accepts both enum names and the contract-style names used by operators ("RepaymentEscrow").
     */
    public static SchemaKind parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("schemaKind is required");
        }
        String normalized = value.trim()
            .replaceAll("([a-z])([A-Z])", "$1_$2")
            .replace('-', '_')
            .toUpperCase(Locale.ROOT);
        try {
            return SchemaKind.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported schemaKind: " + value);
        }
    }
}
