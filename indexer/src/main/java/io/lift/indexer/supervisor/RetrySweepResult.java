package io.lift.indexer.supervisor;

/**
 * Outcome counts of one retry sweep. {@code skipped} rows changed concurrently and were left alone.
 */
public record RetrySweepResult(int processed, int failed, int skipped) {

    public static RetrySweepResult empty() {
        return new RetrySweepResult(0, 0, 0);
    }
}
