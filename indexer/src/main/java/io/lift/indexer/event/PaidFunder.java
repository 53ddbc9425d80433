package io.lift.indexer.event;

import java.math.BigInteger;

public record PaidFunder(BigInteger projectId, BigInteger amount) implements EventPayload {

    public static final String EVENT_NAME = "PaidFunder";

    @Override
    public String eventName() {
        return EVENT_NAME;
    }
}
