package io.lift.indexer.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;

/**
 * Stores payloads as JSON next to their event name and rebuilds the typed record from that pair.
 */
public class EventPayloadCodec {

    private static final Map<String, Class<? extends EventPayload>> PAYLOAD_TYPES = Map.of(
        ProceedsReceived.EVENT_NAME, ProceedsReceived.class,
        PaidFunder.EVENT_NAME, PaidFunder.class,
        PaidPlatform.EVENT_NAME, PaidPlatform.class,
        PaidSteward.EVENT_NAME, PaidSteward.class,
        UnitsSold.EVENT_NAME, UnitsSold.class,
        MarketWindowOpened.EVENT_NAME, MarketWindowOpened.class,
        MarketWindowExtended.EVENT_NAME, MarketWindowExtended.class,
        LiftUnitTransfer.SINGLE_EVENT_NAME, LiftUnitTransfer.class,
        LiftUnitTransfer.BATCH_EVENT_NAME, LiftUnitTransfer.class
    );

    private final ObjectMapper objectMapper;

    public EventPayloadCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String toJson(EventPayload payload) {
        if (payload == null || payload instanceof UnknownPayload) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + payload.eventName() + " payload", e);
        }
    }

    /**
     * Unknown event names and empty documents come back as {@link UnknownPayload}.
     */
    public EventPayload fromJson(String eventName, String json) {
        Class<? extends EventPayload> type = PAYLOAD_TYPES.get(eventName);
        if (type == null || json == null || json.isBlank()) {
            return UnknownPayload.INSTANCE;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored decodedArgs for " + eventName + " are not readable", e);
        }
    }

    public String topicsToJson(List<String> topics) {
        try {
            return objectMapper.writeValueAsString(topics == null ? List.of() : topics);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize topics", e);
        }
    }

    public List<String> topicsFromJson(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return List.of(objectMapper.readValue(json, String[].class));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored topics are not readable", e);
        }
    }
}
