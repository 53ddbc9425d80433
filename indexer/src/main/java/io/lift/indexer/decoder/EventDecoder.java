package io.lift.indexer.decoder;

import io.lift.indexer.chain.RawLog;
import io.lift.indexer.source.SchemaKind;

public interface EventDecoder {

    SchemaKind schemaKind();

    /**
     * Never throws; malformed logs come back as {@link DecodeResult#failure(String)}.
     */
    DecodeResult decode(RawLog log);
}
