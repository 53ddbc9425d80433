package io.lift.indexer.event;

public record UnknownPayload() implements EventPayload {

    public static final String EVENT_NAME = "Unknown";

    public static final UnknownPayload INSTANCE = new UnknownPayload();

    @Override
    public String eventName() {
        return EVENT_NAME;
    }
}
