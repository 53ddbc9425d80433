package io.lift.indexer.poller;

import java.util.Optional;

/**
 * Inclusive block range for one tick.
 */
public record ScanRange(long fromHeight, long toHeight) {

    public ScanRange {
        if (fromHeight > toHeight) {
            throw new IllegalArgumentException("fromHeight > toHeight: " + fromHeight + " > " + toHeight);
        }
    }

    /**
     * Next confirmed range after {@code lastProcessedHeight}, or empty when nothing new is confirmed. A start height
     * past the confirmed head is also empty rather than an error.
     */
    public static Optional<ScanRange> next(
        long lastProcessedHeight,
        long startHeight,
        long headHeight,
        int confirmations,
        int batchSize
    ) {
        long confirmedHeight = headHeight - confirmations;
        if (confirmedHeight < 0 || lastProcessedHeight >= confirmedHeight) {
            return Optional.empty();
        }
        long fromHeight = Math.max(lastProcessedHeight + 1, startHeight);
        long toHeight = Math.min(fromHeight + batchSize - 1, confirmedHeight);
        if (fromHeight > toHeight) {
            return Optional.empty();
        }
        return Optional.of(new ScanRange(fromHeight, toHeight));
    }

    public long size() {
        return toHeight - fromHeight + 1;
    }
}
