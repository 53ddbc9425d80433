package io.lift.indexer.store;

import io.lift.indexer.event.EventPayloadCodec;
import io.lift.indexer.source.SchemaKind;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcEventStore implements EventStore {

    private static final String SELECT_COLUMNS = """
        SELECT id, network_id, contract_address, schema_kind, event_name, event_signature, block_number, block_hash,
               block_timestamp, tx_hash, tx_index, log_index, raw_topics, raw_data, decoded_args, decode_error,
               processed, processed_at, processing_error, retry_count, max_retries, created_at
        FROM indexed_events
        """;

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final EventPayloadCodec payloadCodec;

    public JdbcEventStore(NamedParameterJdbcTemplate jdbcTemplate, EventPayloadCodec payloadCodec) {
        this.jdbcTemplate = jdbcTemplate;
        this.payloadCodec = payloadCodec;
    }

    @Override
    public Optional<IndexedEvent> insertIfAbsent(NewIndexedEvent event) {
        UUID id = UUID.randomUUID();
        int inserted = jdbcTemplate.update(
            """
                INSERT INTO indexed_events(
                  id, network_id, contract_address, schema_kind, event_name, event_signature, block_number, block_hash,
                  block_timestamp, tx_hash, tx_index, log_index, raw_topics, raw_data, decoded_args, decode_error,
                  processed, retry_count, max_retries, created_at
                )
                VALUES (
                  :id, :networkId, :contractAddress, :schemaKind, :eventName, :eventSignature, :blockNumber, :blockHash,
                  :blockTimestamp, :txHash, :txIndex, :logIndex, :rawTopics, :rawData, :decodedArgs, :decodeError,
                  FALSE, 0, :maxRetries, :createdAt
                )
                ON CONFLICT DO NOTHING
                """,
            new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("networkId", event.networkId())
                .addValue("contractAddress", event.contractAddress())
                .addValue("schemaKind", event.schemaKind().name())
                .addValue("eventName", event.eventName())
                .addValue("eventSignature", event.eventSignature())
                .addValue("blockNumber", event.blockNumber())
                .addValue("blockHash", event.blockHash())
                .addValue("blockTimestamp", Timestamp.from(event.blockTimestamp()), Types.TIMESTAMP)
                .addValue("txHash", event.txHash())
                .addValue("txIndex", event.txIndex())
                .addValue("logIndex", event.logIndex())
                .addValue("rawTopics", payloadCodec.topicsToJson(event.rawTopics()))
                .addValue("rawData", event.rawData())
                .addValue("decodedArgs", payloadCodec.toJson(event.decodedArgs()))
                .addValue("decodeError", event.decodeError())
                .addValue("maxRetries", event.maxRetries())
                .addValue("createdAt", Timestamp.from(Instant.now()), Types.TIMESTAMP)
        );
        if (inserted != 1) {
            return Optional.empty();
        }
        return findById(id);
    }

    @Override
    public Optional<IndexedEvent> findByLogKey(long networkId, String txHash, long logIndex) {
        List<IndexedEvent> rows = jdbcTemplate.query(
            SELECT_COLUMNS + " WHERE network_id = :networkId AND tx_hash = :txHash AND log_index = :logIndex",
            new MapSqlParameterSource()
                .addValue("networkId", networkId)
                .addValue("txHash", txHash)
                .addValue("logIndex", logIndex),
            this::toIndexedEvent
        );
        return rows.stream().findFirst();
    }

    @Override
    public boolean markProcessed(UUID id, int expectedRetryCount, Instant now) {
        int updated = jdbcTemplate.update(
            """
                UPDATE indexed_events
                SET processed = TRUE,
                    processed_at = :now,
                    processing_error = NULL
                WHERE id = :id
                  AND processed = FALSE
                  AND retry_count = :expectedRetryCount
                """,
            new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("expectedRetryCount", expectedRetryCount)
                .addValue("now", Timestamp.from(now), Types.TIMESTAMP)
        );
        return updated == 1;
    }

    @Override
    public boolean markFailed(UUID id, int expectedRetryCount, String error) {
        int updated = jdbcTemplate.update(
            """
                UPDATE indexed_events
                SET processing_error = :error,
                    retry_count = retry_count + 1
                WHERE id = :id
                  AND processed = FALSE
                  AND retry_count = :expectedRetryCount
                  AND retry_count < max_retries
                """,
            new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("expectedRetryCount", expectedRetryCount)
                .addValue("error", error == null ? "unknown error" : error)
        );
        return updated == 1;
    }

    @Override
    public List<IndexedEvent> findRetryable(int limit) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + """
                WHERE processed = FALSE
                  AND processing_error IS NOT NULL
                  AND retry_count < max_retries
                ORDER BY created_at ASC, block_number ASC, log_index ASC
                LIMIT :limit
                """,
            Map.of("limit", Math.max(1, limit)),
            this::toIndexedEvent
        );
    }

    @Override
    public Optional<IndexedEvent> findById(UUID id) {
        List<IndexedEvent> rows = jdbcTemplate.query(
            SELECT_COLUMNS + " WHERE id = :id",
            Map.of("id", id),
            this::toIndexedEvent
        );
        return rows.stream().findFirst();
    }

    @Override
    public EventPage find(EventFilter filter) {
        StringBuilder where = new StringBuilder(" WHERE 1 = 1");
        MapSqlParameterSource params = new MapSqlParameterSource();
        if (filter.networkId() != null) {
            where.append(" AND network_id = :networkId");
            params.addValue("networkId", filter.networkId());
        }
        if (filter.contractAddress() != null && !filter.contractAddress().isBlank()) {
            where.append(" AND contract_address = :contractAddress");
            params.addValue("contractAddress", filter.contractAddress().trim().toLowerCase(Locale.ROOT));
        }
        if (filter.eventName() != null && !filter.eventName().isBlank()) {
            where.append(" AND event_name = :eventName");
            params.addValue("eventName", filter.eventName().trim());
        }
        if (filter.processed() != null) {
            where.append(" AND processed = :processed");
            params.addValue("processed", filter.processed());
        }
        if (filter.hasError() != null) {
            where.append(filter.hasError() ? " AND processing_error IS NOT NULL" : " AND processing_error IS NULL");
        }
        if (filter.status() != null) {
            where.append(" AND ").append(filter.status().sqlPredicate());
        }

        Long total = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM indexed_events" + where,
            params,
            Long.class
        );

        int limit = filter.effectiveLimit();
        int offset = filter.effectiveOffset();
        params.addValue("limit", limit).addValue("offset", offset);
        List<IndexedEvent> events = jdbcTemplate.query(
            SELECT_COLUMNS + where + " ORDER BY block_number DESC, log_index DESC LIMIT :limit OFFSET :offset",
            params,
            this::toIndexedEvent
        );
        return new EventPage(events, total == null ? 0L : total, limit, offset);
    }

    @Override
    public long countByStatus(EventProcessingStatus status) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM indexed_events WHERE " + status.sqlPredicate(),
            new MapSqlParameterSource(),
            Long.class
        );
        return count == null ? 0L : count;
    }

    private IndexedEvent toIndexedEvent(ResultSet rs, int rowNum) throws SQLException {
        String eventName = rs.getString("event_name");
        return new IndexedEvent(
            rs.getObject("id", UUID.class),
            rs.getLong("network_id"),
            rs.getString("contract_address"),
            SchemaKind.valueOf(rs.getString("schema_kind")),
            eventName,
            rs.getString("event_signature"),
            rs.getLong("block_number"),
            rs.getString("block_hash"),
            toInstant(rs.getTimestamp("block_timestamp")),
            rs.getString("tx_hash"),
            rs.getLong("tx_index"),
            rs.getLong("log_index"),
            payloadCodec.topicsFromJson(rs.getString("raw_topics")),
            rs.getString("raw_data"),
            payloadCodec.fromJson(eventName, rs.getString("decoded_args")),
            rs.getString("decode_error"),
            rs.getBoolean("processed"),
            toInstant(rs.getTimestamp("processed_at")),
            rs.getString("processing_error"),
            rs.getInt("retry_count"),
            rs.getInt("max_retries"),
            toInstant(rs.getTimestamp("created_at"))
        );
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
