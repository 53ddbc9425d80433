package io.lift.indexer.event;

import java.math.BigInteger;

public record MarketWindowExtended(BigInteger projectId, long newClosesAt) implements EventPayload {

    public static final String EVENT_NAME = "MarketWindowExtended";

    @Override
    public String eventName() {
        return EVENT_NAME;
    }
}
