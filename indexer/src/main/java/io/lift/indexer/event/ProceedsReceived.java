package io.lift.indexer.event;

import java.math.BigInteger;

public record ProceedsReceived(BigInteger projectId, BigInteger amount, String considerationRef) implements EventPayload {

    public static final String EVENT_NAME = "ProceedsReceived";

    @Override
    public String eventName() {
        return EVENT_NAME;
    }
}
