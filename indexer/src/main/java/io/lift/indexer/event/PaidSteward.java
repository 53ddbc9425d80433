package io.lift.indexer.event;

import java.math.BigInteger;

public record PaidSteward(BigInteger projectId, BigInteger amount) implements EventPayload {

    public static final String EVENT_NAME = "PaidSteward";

    @Override
    public String eventName() {
        return EVENT_NAME;
    }
}
