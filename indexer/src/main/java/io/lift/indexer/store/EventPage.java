package io.lift.indexer.store;

import java.util.List;

public record EventPage(List<IndexedEvent> events, long total, int limit, int offset) {
}
