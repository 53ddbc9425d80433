package io.lift.indexer.event;

import java.math.BigInteger;

public record PaidPlatform(BigInteger projectId, BigInteger amount) implements EventPayload {

    public static final String EVENT_NAME = "PaidPlatform";

    @Override
    public String eventName() {
        return EVENT_NAME;
    }
}
