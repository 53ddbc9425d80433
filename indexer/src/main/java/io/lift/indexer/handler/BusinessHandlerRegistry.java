package io.lift.indexer.handler;

import io.lift.indexer.source.SchemaKind;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class BusinessHandlerRegistry {

    private final Map<SchemaKind, BusinessHandler> handlers = new EnumMap<>(SchemaKind.class);

    public BusinessHandlerRegistry(List<BusinessHandler> handlers) {
        for (BusinessHandler handler : handlers) {
            BusinessHandler previous = this.handlers.put(handler.schemaKind(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate business handler for schemaKind " + handler.schemaKind());
            }
        }
    }

    public Optional<BusinessHandler> handlerFor(SchemaKind schemaKind) {
        return Optional.ofNullable(handlers.get(schemaKind));
    }
}
