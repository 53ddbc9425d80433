package io.lift.indexer.decoder;

import io.lift.indexer.event.EventPayload;
import io.lift.indexer.event.UnknownPayload;

/**
 * Either a typed payload or the reason the log could not be decoded.
 */
public record DecodeResult(EventPayload payload, String error) {

    public static DecodeResult decoded(EventPayload payload) {
        return new DecodeResult(payload, null);
    }

    public static DecodeResult failure(String error) {
        return new DecodeResult(UnknownPayload.INSTANCE, error == null ? "decode failed" : error);
    }

    public boolean isDecoded() {
        return error == null && !(payload instanceof UnknownPayload);
    }

    public String eventName() {
        return payload.eventName();
    }
}
