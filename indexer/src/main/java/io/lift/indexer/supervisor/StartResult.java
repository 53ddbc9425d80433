package io.lift.indexer.supervisor;

public record StartResult(Outcome outcome, int activePollerCount) {

    public enum Outcome {
        ACCEPTED,
        ALREADY_RUNNING
    }

    public boolean accepted() {
        return outcome == Outcome.ACCEPTED;
    }
}
