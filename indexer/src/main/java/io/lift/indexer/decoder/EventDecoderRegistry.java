package io.lift.indexer.decoder;

import io.lift.indexer.chain.RawLog;
import io.lift.indexer.source.SchemaKind;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class EventDecoderRegistry {

    private static final Logger log = LoggerFactory.getLogger(EventDecoderRegistry.class);

    private final Map<SchemaKind, EventDecoder> decoders = new EnumMap<>(SchemaKind.class);

    public EventDecoderRegistry(List<EventDecoder> decoders) {
        for (EventDecoder decoder : decoders) {
            EventDecoder previous = this.decoders.put(decoder.schemaKind(), decoder);
            if (previous != null) {
                throw new IllegalStateException("Duplicate decoder for schemaKind " + decoder.schemaKind());
            }
        }
    }

    public DecodeResult decode(SchemaKind schemaKind, RawLog rawLog) {
        EventDecoder decoder = schemaKind == null ? null : decoders.get(schemaKind);
        if (decoder == null) {
            return DecodeResult.failure("No decoder registered for schemaKind " + schemaKind);
        }
        try {
            DecodeResult result = decoder.decode(rawLog);
            return result == null ? DecodeResult.failure("Decoder returned no result") : result;
        } catch (RuntimeException e) {
            log.warn("Decoder {} threw for tx={}, logIndex={}", schemaKind, rawLog.txHash(), rawLog.logIndex(), e);
            return DecodeResult.failure(e.getMessage());
        }
    }
}
