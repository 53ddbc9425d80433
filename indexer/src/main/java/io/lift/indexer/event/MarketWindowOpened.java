package io.lift.indexer.event;

import java.math.BigInteger;

public record MarketWindowOpened(BigInteger projectId, long closesAt) implements EventPayload {

    public static final String EVENT_NAME = "MarketWindowOpened";

    @Override
    public String eventName() {
        return EVENT_NAME;
    }
}
